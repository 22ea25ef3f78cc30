package org.javai.springai.weave.ai;

import java.util.List;
import org.javai.springai.weave.EngineConfig;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.state.PendingRequest;
import org.javai.springai.weave.tool.ToolRegistry;
import org.javai.springai.weave.tool.ToolSchema;
import org.javai.springai.weave.value.Value;
import org.javai.springai.weave.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs the AI request a suspended state is waiting on.
 *
 * <ul>
 * <li>{@code do}: one round, or up to {@link EngineConfig#maxToolRounds()} when the model has tools.</li>
 * <li>{@code vibe}: a tool conversation when the model has tools, otherwise one code-generation call.
 * The generated text is returned as is; parsing it is the engine's job and is never retried here.</li>
 * <li>{@code compress}: one round, retried only when {@link EngineConfig#retryCompress()} is set.</li>
 * </ul>
 *
 * <p>Every provider call goes through the {@link Retrier}. A model's
 * {@code maxRetriesOnError} overrides the configured retry count.</p>
 */
public class AiExecutor {

	private static final Logger logger = LoggerFactory.getLogger(AiExecutor.class);

	private final AiProvider provider;
	private final ToolRegistry tools;
	private final EngineConfig config;
	private final Retrier retrier;
	private final ToolCallingLoop toolLoop;

	public AiExecutor(AiProvider provider, ToolRegistry tools, EngineConfig config) {
		this(provider, tools, config, new Retrier(), new ToolCallingLoop(tools));
	}

	public AiExecutor(AiProvider provider, ToolRegistry tools, EngineConfig config, Retrier retrier,
			ToolCallingLoop toolLoop) {
		this.provider = provider;
		this.tools = tools;
		this.config = config;
		this.retrier = retrier;
		this.toolLoop = toolLoop;
	}

	public AiOutcome execute(PendingRequest.PendingAi pending) {
		if (pending.operation() == AiOperation.ASK) {
			throw new IllegalArgumentException("ask requests are answered by the user, not a model");
		}
		List<ToolSchema> schemas = tools.schemas(pending.tools());
		AiRequest request = new AiRequest(pending.operation(), pending.prompt(), pending.contextText(),
				pending.targetType(), pending.model(), schemas, List.of());
		RetryPolicy policy = retryPolicyFor(pending);
		logger.info("Sending {} request to model '{}' ({} tool(s))", pending.operation().keyword(),
				pending.model().name(), schemas.size());

		long start = System.currentTimeMillis();
		AiOutcome outcome;
		if (pending.operation() == AiOperation.VIBE && schemas.isEmpty()) {
			String code = retrier.withRetry(() -> provider.generateCode(request), policy);
			outcome = new AiOutcome(code, TokenUsage.NONE, List.of(), System.currentTimeMillis() - start);
		}
		else {
			int maxRounds = schemas.isEmpty() || pending.operation() == AiOperation.COMPRESS ? 1 : config.maxToolRounds();
			ToolLoopResult result = toolLoop.run(request, maxRounds,
					req -> retrier.withRetry(() -> provider.execute(req), policy));
			outcome = new AiOutcome(contentOf(result.response()), result.usage(), result.rounds(),
					System.currentTimeMillis() - start);
		}
		logger.info("Model '{}' answered {} request in {} ms ({} tokens)", pending.model().name(),
				pending.operation().keyword(), outcome.durationMillis(),
				outcome.usage() != null ? outcome.usage().totalTokens() : 0);
		return outcome;
	}

	private RetryPolicy retryPolicyFor(PendingRequest.PendingAi pending) {
		if (pending.operation() == AiOperation.COMPRESS && !config.retryCompress()) {
			return RetryPolicy.none();
		}
		Integer override = pending.model().maxRetriesOnError();
		return override != null ? config.retryPolicy().withMaxRetries(override) : config.retryPolicy();
	}

	/**
	 * The response text; a provider that only filled {@code parsedValue}
	 * has it rendered back to text so the engine coerces one form.
	 */
	private static String contentOf(AiResponse response) {
		if (!response.content().isEmpty() || response.parsedValue() == null) {
			return response.content();
		}
		Value parsed = response.parsedValue();
		return parsed instanceof Value.Text text ? text.value() : Values.toJsonNode(parsed).toString();
	}
}
