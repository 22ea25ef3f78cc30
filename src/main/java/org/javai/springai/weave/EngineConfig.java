package org.javai.springai.weave;

import java.util.Objects;
import org.javai.springai.weave.ai.ModelConfig;
import org.javai.springai.weave.ai.RetryPolicy;

/**
 * Engine-wide settings.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *         .defaultModel(ModelConfig.builder("default").modelName("gpt-4.1-mini").build())
 *         .maxToolRounds(5)
 *         .build();
 * }</pre>
 *
 * @param redefinitionPolicy how generated functions may replace existing ones
 * @param maxToolRounds round cap for tool-enabled {@code do} and {@code vibe}
 * @param retryPolicy backoff for retryable provider failures
 * @param retryCompress whether loop-summary requests are retried
 * @param compressPrompt prompt used to summarize a compressed loop
 * @param defaultModel model used when a program names {@code default} or no model
 */
public record EngineConfig(
		FunctionRedefinitionPolicy redefinitionPolicy,
		int maxToolRounds,
		RetryPolicy retryPolicy,
		boolean retryCompress,
		String compressPrompt,
		ModelConfig defaultModel
) {

	public static final int DEFAULT_MAX_TOOL_ROUNDS = 10;

	public static final String DEFAULT_COMPRESS_PROMPT =
			"Summarize the following loop iterations concisely, keeping every fact a later step may need.";

	public EngineConfig {
		Objects.requireNonNull(redefinitionPolicy, "redefinitionPolicy must not be null");
		Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
		Objects.requireNonNull(compressPrompt, "compressPrompt must not be null");
		Objects.requireNonNull(defaultModel, "defaultModel must not be null");
		if (maxToolRounds < 1) {
			throw new IllegalArgumentException("maxToolRounds must be >= 1");
		}
	}

	public static EngineConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private FunctionRedefinitionPolicy redefinitionPolicy = FunctionRedefinitionPolicy.OVERWRITE_GENERATED;
		private int maxToolRounds = DEFAULT_MAX_TOOL_ROUNDS;
		private RetryPolicy retryPolicy = RetryPolicy.defaults();
		private boolean retryCompress = false;
		private String compressPrompt = DEFAULT_COMPRESS_PROMPT;
		private ModelConfig defaultModel = ModelConfig.named("default");

		private Builder() {
		}

		public Builder redefinitionPolicy(FunctionRedefinitionPolicy redefinitionPolicy) {
			this.redefinitionPolicy = redefinitionPolicy;
			return this;
		}

		public Builder maxToolRounds(int maxToolRounds) {
			this.maxToolRounds = maxToolRounds;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		/**
		 * Enables retrying loop-summary requests with the normal retry policy.
		 * Off by default: a failed summary aborts the run.
		 */
		public Builder retryCompress(boolean retryCompress) {
			this.retryCompress = retryCompress;
			return this;
		}

		public Builder compressPrompt(String compressPrompt) {
			this.compressPrompt = compressPrompt;
			return this;
		}

		public Builder defaultModel(ModelConfig defaultModel) {
			this.defaultModel = defaultModel;
			return this;
		}

		public EngineConfig build() {
			return new EngineConfig(redefinitionPolicy, maxToolRounds, retryPolicy, retryCompress, compressPrompt,
					defaultModel);
		}
	}
}
