package org.javai.springai.weave.run;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.javai.springai.weave.WeaveEngine;
import org.javai.springai.weave.WeaveException;
import org.javai.springai.weave.ai.AiExecutor;
import org.javai.springai.weave.ai.AiOutcome;
import org.javai.springai.weave.module.ModuleEntry;
import org.javai.springai.weave.module.ModuleKind;
import org.javai.springai.weave.state.ErrorInfo;
import org.javai.springai.weave.state.PendingRequest;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.tool.ToolExecutionContext;
import org.javai.springai.weave.tool.ToolResult;
import org.javai.springai.weave.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a program to a terminal state by performing every pending request
 * in-process.
 *
 * <p>The runner is one possible driver: hosts that persist states between
 * requests call the engine's resume operations themselves. A failure of the
 * collaborator performing a request (after the AI executor's retries) marks
 * the state {@code ERROR} and is rethrown.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * WeaveRunner runner = WeaveRunner.builder(engine, new AiExecutor(provider, tools, config))
 *         .userInput(console::readLine)
 *         .build();
 * RuntimeState done = runner.run(engine.newState(program));
 * }</pre>
 */
public class WeaveRunner {

	private static final Logger logger = LoggerFactory.getLogger(WeaveRunner.class);

	private final WeaveEngine engine;
	private final AiExecutor aiExecutor;
	private final UserInputProvider userInput;
	private final HostEvaluator hostEvaluator;
	private final ToolExecutionContext toolContext;
	private final Executor toolExecutor;

	private WeaveRunner(Builder builder) {
		this.engine = builder.engine;
		this.aiExecutor = builder.aiExecutor;
		this.userInput = builder.userInput;
		this.hostEvaluator = builder.hostEvaluator;
		this.toolContext = builder.toolContext;
		this.toolExecutor = builder.toolExecutor;
	}

	public static Builder builder(WeaveEngine engine, AiExecutor aiExecutor) {
		return new Builder(engine, aiExecutor);
	}

	/**
	 * Advances {@code state} until it completes or fails.
	 *
	 * @return the terminal state
	 */
	public RuntimeState run(RuntimeState state) {
		RuntimeState current = engine.runUntilPause(state);
		while (!current.status().isTerminal()) {
			current = engine.runUntilPause(dispatch(current));
		}
		logger.info("Run finished with status {}", current.status());
		return current;
	}

	private RuntimeState dispatch(RuntimeState state) {
		PendingRequest pending = state.pendingRequest();
		switch (state.status()) {
			case AWAITING_AI -> {
				PendingRequest.PendingAi request = (PendingRequest.PendingAi) pending;
				logger.info("Sending {} request to model '{}'", request.operation(),
						request.model() != null ? request.model().name() : null);
				AiOutcome outcome = perform(state, () -> aiExecutor.execute(request));
				logger.info("Received {} characters in {} ms", outcome.content().length(), outcome.durationMillis());
				return engine.resumeWithAIResponse(state, outcome);
			}
			case AWAITING_USER -> {
				PendingRequest.PendingAi request = (PendingRequest.PendingAi) pending;
				String answer = perform(state, () -> userInput.ask(request.prompt()));
				return engine.resumeWithUserInput(state, answer);
			}
			case AWAITING_TOOL_EVAL -> {
				PendingRequest.PendingToolEval request = (PendingRequest.PendingToolEval) pending;
				List<ToolResult> results = engine.tools().executeAll(request.toolCalls(), toolContext, toolExecutor);
				return engine.resumeWithToolResults(state, results);
			}
			case AWAITING_HOST_EVAL -> {
				Value result = perform(state, () -> evaluateHost(state, pending));
				return engine.resumeWithHostResult(state, result);
			}
			default -> throw new IllegalStateException("Cannot dispatch a state with status " + state.status());
		}
	}

	private Value evaluateHost(RuntimeState state, PendingRequest pending) {
		if (pending instanceof PendingRequest.PendingHostEval eval) {
			return hostEvaluator.evaluate(eval.params(), eval.body(), eval.argValues());
		}
		PendingRequest.PendingHostCall call = (PendingRequest.PendingHostCall) pending;
		ModuleEntry module = state.moduleTable().get(call.modulePath());
		if (module == null || module.kind() != ModuleKind.HOST) {
			throw new IllegalStateException("No host module loaded at '" + call.modulePath() + "'");
		}
		return module.hostModule().invoke(call.exportName(), call.args());
	}

	private <T> T perform(RuntimeState state, Request<T> request) {
		try {
			return request.perform();
		}
		catch (WeaveException e) {
			state.fail(new ErrorInfo(e.errorType(), e.getMessage()));
			throw e;
		}
		catch (RuntimeException e) {
			state.fail(new ErrorInfo("Driver", e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
			throw e;
		}
	}

	@FunctionalInterface
	private interface Request<T> {
		T perform();
	}

	public static final class Builder {
		private final WeaveEngine engine;
		private final AiExecutor aiExecutor;
		private UserInputProvider userInput = prompt -> {
			throw new UnsupportedOperationException("No user input provider configured");
		};
		private HostEvaluator hostEvaluator = HostEvaluator.unsupported();
		private ToolExecutionContext toolContext = ToolExecutionContext.empty();
		private Executor toolExecutor;

		private Builder(WeaveEngine engine, AiExecutor aiExecutor) {
			this.engine = Objects.requireNonNull(engine, "engine must not be null");
			this.aiExecutor = Objects.requireNonNull(aiExecutor, "aiExecutor must not be null");
		}

		public Builder userInput(UserInputProvider userInput) {
			this.userInput = Objects.requireNonNull(userInput);
			return this;
		}

		public Builder hostEvaluator(HostEvaluator hostEvaluator) {
			this.hostEvaluator = Objects.requireNonNull(hostEvaluator);
			return this;
		}

		public Builder toolContext(ToolExecutionContext toolContext) {
			this.toolContext = Objects.requireNonNull(toolContext);
			return this;
		}

		/**
		 * Executor for direct tool calls; {@code null} runs them in order.
		 */
		public Builder toolExecutor(Executor toolExecutor) {
			this.toolExecutor = toolExecutor;
			return this;
		}

		public WeaveRunner build() {
			return new WeaveRunner(this);
		}
	}
}
