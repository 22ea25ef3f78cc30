package org.javai.springai.weave.ai;

import java.util.List;

/**
 * What a driver hands back to the engine after performing an AI request:
 * the final text plus the bookkeeping that goes into the interaction log.
 */
public record AiOutcome(String content, TokenUsage usage, List<ToolRound> toolRounds, long durationMillis) {

	public AiOutcome {
		content = content != null ? content : "";
		toolRounds = toolRounds != null ? List.copyOf(toolRounds) : List.of();
	}

	public static AiOutcome of(String content) {
		return new AiOutcome(content, null, List.of(), 0);
	}
}
