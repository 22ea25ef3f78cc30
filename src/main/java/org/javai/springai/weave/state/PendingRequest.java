package org.javai.springai.weave.state;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Objects;
import org.javai.springai.weave.ai.ModelConfig;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.value.TargetType;
import org.javai.springai.weave.value.Value;

/**
 * The operation a suspended state is waiting on. Each variant is
 * self-contained so a driver can perform it from the serialized state alone.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
		@JsonSubTypes.Type(value = PendingRequest.PendingAi.class, name = "ai"),
		@JsonSubTypes.Type(value = PendingRequest.PendingToolEval.class, name = "toolEval"),
		@JsonSubTypes.Type(value = PendingRequest.PendingHostEval.class, name = "hostEval"),
		@JsonSubTypes.Type(value = PendingRequest.PendingHostCall.class, name = "hostCall")
})
public sealed interface PendingRequest {

	/**
	 * The status a state carrying this request must have.
	 */
	RuntimeStatus awaitingStatus();

	/**
	 * An AI request ({@code do}, {@code vibe}, {@code compress}) or a user
	 * question ({@code ask}).
	 *
	 * @param operation what kind of request this is
	 * @param prompt the rendered prompt text
	 * @param model the model to send it to
	 * @param targetType required response shape, {@code null} for free text
	 * @param contextText the program context rendered at suspension time
	 * @param tools names of tools the model may call
	 */
	record PendingAi(AiOperation operation, String prompt, ModelConfig model, TargetType targetType,
			String contextText, List<String> tools) implements PendingRequest {

		public PendingAi {
			Objects.requireNonNull(operation, "operation must not be null");
			Objects.requireNonNull(prompt, "prompt must not be null");
			contextText = contextText != null ? contextText : "";
			tools = tools != null ? List.copyOf(tools) : List.of();
		}

		@Override
		public RuntimeStatus awaitingStatus() {
			return operation == AiOperation.ASK ? RuntimeStatus.AWAITING_USER : RuntimeStatus.AWAITING_AI;
		}
	}

	/**
	 * Tool calls issued directly by program code.
	 */
	record PendingToolEval(List<ToolCall> toolCalls) implements PendingRequest {

		public PendingToolEval {
			toolCalls = List.copyOf(toolCalls);
		}

		@Override
		public RuntimeStatus awaitingStatus() {
			return RuntimeStatus.AWAITING_TOOL_EVAL;
		}
	}

	/**
	 * An inline host-code block with the values of its parameters.
	 */
	record PendingHostEval(List<String> params, String body, List<Value> argValues) implements PendingRequest {

		public PendingHostEval {
			params = List.copyOf(params);
			argValues = List.copyOf(argValues);
			if (params.size() != argValues.size()) {
				throw new IllegalArgumentException("params and argValues must have the same size");
			}
		}

		@Override
		public RuntimeStatus awaitingStatus() {
			return RuntimeStatus.AWAITING_HOST_EVAL;
		}
	}

	/**
	 * A call to a function exported by a host module.
	 */
	record PendingHostCall(String modulePath, String exportName, List<Value> args) implements PendingRequest {

		public PendingHostCall {
			Objects.requireNonNull(modulePath, "modulePath must not be null");
			Objects.requireNonNull(exportName, "exportName must not be null");
			args = List.copyOf(args);
		}

		@Override
		public RuntimeStatus awaitingStatus() {
			return RuntimeStatus.AWAITING_HOST_EVAL;
		}
	}
}
