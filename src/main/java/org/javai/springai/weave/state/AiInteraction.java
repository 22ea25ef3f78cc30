package org.javai.springai.weave.state;

import java.util.List;
import org.javai.springai.weave.ai.TokenUsage;
import org.javai.springai.weave.ai.ToolRound;
import org.javai.springai.weave.value.TargetType;

/**
 * Audit record of one completed AI or user exchange.
 */
public record AiInteraction(
		AiOperation operation,
		String prompt,
		String model,
		TargetType targetType,
		String response,
		TokenUsage usage,
		List<ToolRound> toolRounds,
		long durationMillis
) {

	public AiInteraction {
		toolRounds = toolRounds != null ? List.copyOf(toolRounds) : List.of();
	}
}
