package org.javai.springai.weave.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.javai.springai.weave.tool.ToolExecutionContext;
import org.javai.springai.weave.tool.ToolRegistry;
import org.javai.springai.weave.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a bounded multi-round conversation in which the model may call
 * tools before it answers.
 *
 * <p>Each round sends the request with the history so far. A response
 * without tool calls ends the conversation. Otherwise every call is executed
 * through the {@link ToolRegistry}, which turns failures (including unknown
 * tools) into error results for the model, and the round is appended to the
 * history. After {@code maxRounds} rounds the last response is final even
 * though it asked for tools; a capped conversation is not an error.</p>
 */
public class ToolCallingLoop {

	private static final Logger logger = LoggerFactory.getLogger(ToolCallingLoop.class);

	private final ToolRegistry tools;
	private final ToolExecutionContext context;
	private final Executor executor;

	/**
	 * Runs tool calls sequentially with an empty execution context.
	 *
	 * @param tools the tools the model may call
	 */
	public ToolCallingLoop(ToolRegistry tools) {
		this(tools, ToolExecutionContext.empty(), null);
	}

	/**
	 * @param tools the tools the model may call
	 * @param context passed to every tool invocation
	 * @param executor runs the calls of one round concurrently; {@code null} runs them in order
	 */
	public ToolCallingLoop(ToolRegistry tools, ToolExecutionContext context, Executor executor) {
		this.tools = tools;
		this.context = context;
		this.executor = executor;
	}

	/**
	 * @param request the first request; later rounds extend its history
	 * @param maxRounds upper bound on model calls, at least 1
	 * @param send performs one request, typically a provider call wrapped in retries
	 * @return the final response with every completed round and the summed usage
	 * @throws IllegalArgumentException if {@code maxRounds} is below 1
	 */
	public ToolLoopResult run(AiRequest request, int maxRounds, Function<AiRequest, AiResponse> send) {
		if (maxRounds < 1) {
			throw new IllegalArgumentException("maxRounds must be >= 1");
		}
		List<ToolRound> rounds = new ArrayList<>();
		TokenUsage usage = TokenUsage.NONE;
		AiRequest current = request;
		AiResponse response = null;
		for (int round = 1; round <= maxRounds; round++) {
			response = send.apply(current);
			usage = usage.plus(response.usage());
			if (!response.hasToolCalls()) {
				return new ToolLoopResult(response, rounds, false, usage);
			}
			logger.debug("Round {}: executing {} tool call(s)", round, response.toolCalls().size());
			List<ToolResult> results = tools.executeAll(response.toolCalls(), context, executor);
			ToolRound completed = new ToolRound(response.toolCalls(), results);
			rounds.add(completed);
			current = current.withRound(completed);
		}
		logger.warn("Tool loop stopped after {} round(s); the model was still calling tools", maxRounds);
		return new ToolLoopResult(response, rounds, true, usage);
	}
}
