package org.javai.springai.weave.ai;

import java.util.List;

/**
 * Outcome of a tool-calling conversation.
 *
 * @param response the final response
 * @param rounds completed tool rounds, oldest first
 * @param capped whether the conversation stopped at the round cap while the model still wanted tools
 * @param usage tokens summed over every request of the conversation
 */
public record ToolLoopResult(AiResponse response, List<ToolRound> rounds, boolean capped, TokenUsage usage) {

	public ToolLoopResult {
		rounds = List.copyOf(rounds);
	}
}
