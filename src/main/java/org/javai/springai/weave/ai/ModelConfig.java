package org.javai.springai.weave.ai;

import java.util.List;
import java.util.Objects;
import org.javai.springai.weave.value.Value;

/**
 * Provider-facing description of a model, built from a program's model
 * declaration or from {@link org.javai.springai.weave.EngineConfig#defaultModel()}.
 *
 * @param name the name the program knows the model by
 * @param modelName the provider's model identifier (e.g. "gpt-4.1-mini")
 * @param provider provider family, informational for adapters
 * @param url optional endpoint override
 * @param apiKeyEnv environment variable holding the API key
 * @param maxRetriesOnError per-model retry override, {@code null} for the engine default
 * @param tools names of the tools the model may call
 */
public record ModelConfig(
		String name,
		String modelName,
		String provider,
		String url,
		String apiKeyEnv,
		Integer maxRetriesOnError,
		List<String> tools
) {

	public ModelConfig {
		Objects.requireNonNull(name, "name must not be null");
		tools = tools != null ? List.copyOf(tools) : List.of();
		if (maxRetriesOnError != null && maxRetriesOnError < 0) {
			throw new IllegalArgumentException("maxRetriesOnError must be >= 0");
		}
	}

	public static ModelConfig named(String name) {
		return new ModelConfig(name, null, null, null, null, null, List.of());
	}

	public static ModelConfig from(Value.ModelRef ref) {
		return new ModelConfig(ref.name(), ref.modelName(), ref.provider(), ref.url(), ref.apiKeyEnv(),
				ref.maxRetriesOnError(), ref.tools());
	}

	public Value.ModelRef toRef() {
		return new Value.ModelRef(name, modelName, provider, url, apiKeyEnv, maxRetriesOnError, tools);
	}

	public boolean hasTools() {
		return !tools.isEmpty();
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public static final class Builder {
		private final String name;
		private String modelName;
		private String provider;
		private String url;
		private String apiKeyEnv;
		private Integer maxRetriesOnError;
		private List<String> tools = List.of();

		private Builder(String name) {
			this.name = name;
		}

		public Builder modelName(String modelName) {
			this.modelName = modelName;
			return this;
		}

		public Builder provider(String provider) {
			this.provider = provider;
			return this;
		}

		public Builder url(String url) {
			this.url = url;
			return this;
		}

		public Builder apiKeyEnv(String apiKeyEnv) {
			this.apiKeyEnv = apiKeyEnv;
			return this;
		}

		public Builder maxRetriesOnError(Integer maxRetriesOnError) {
			this.maxRetriesOnError = maxRetriesOnError;
			return this;
		}

		public Builder tools(List<String> tools) {
			this.tools = tools;
			return this;
		}

		public ModelConfig build() {
			return new ModelConfig(name, modelName, provider, url, apiKeyEnv, maxRetriesOnError, tools);
		}
	}
}
