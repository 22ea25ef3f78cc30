package org.javai.springai.weave.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.tool.ToolSchema;
import org.javai.springai.weave.value.TargetType;

/**
 * Provider-agnostic AI request.
 *
 * @param operation the language operation the request serves
 * @param prompt rendered prompt text
 * @param contextText rendered program context, possibly empty
 * @param targetType response shape the engine requires, {@code null} for free text
 * @param model the model to call
 * @param tools schemas of the tools the model may call
 * @param history earlier rounds of a tool-calling conversation, oldest first
 */
public record AiRequest(
		AiOperation operation,
		String prompt,
		String contextText,
		TargetType targetType,
		ModelConfig model,
		List<ToolSchema> tools,
		List<ToolRound> history
) {

	public AiRequest {
		Objects.requireNonNull(operation, "operation must not be null");
		Objects.requireNonNull(prompt, "prompt must not be null");
		Objects.requireNonNull(model, "model must not be null");
		contextText = contextText != null ? contextText : "";
		tools = tools != null ? List.copyOf(tools) : List.of();
		history = history != null ? List.copyOf(history) : List.of();
	}

	public boolean hasTools() {
		return !tools.isEmpty();
	}

	/**
	 * This request with one more completed round appended to its history.
	 */
	public AiRequest withRound(ToolRound round) {
		List<ToolRound> rounds = new ArrayList<>(history);
		rounds.add(round);
		return new AiRequest(operation, prompt, contextText, targetType, model, tools, rounds);
	}
}
