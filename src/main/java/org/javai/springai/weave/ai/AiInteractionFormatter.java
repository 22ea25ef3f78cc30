package org.javai.springai.weave.ai;

import java.util.List;
import org.javai.springai.weave.state.AiInteraction;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolResult;

/**
 * Renders the AI interaction log as markdown for audit.
 */
public final class AiInteractionFormatter {

	private AiInteractionFormatter() {
	}

	public static String format(List<AiInteraction> interactions) {
		StringBuilder sb = new StringBuilder("# AI Interactions\n");
		if (interactions.isEmpty()) {
			sb.append("\n_No interactions._\n");
			return sb.toString();
		}
		TokenUsage total = TokenUsage.NONE;
		for (int i = 0; i < interactions.size(); i++) {
			AiInteraction interaction = interactions.get(i);
			appendInteraction(sb, i + 1, interaction);
			if (interaction.usage() != null) {
				total = total.plus(interaction.usage());
			}
		}
		sb.append("\n---\n\n");
		sb.append("Total: ").append(interactions.size()).append(" interaction(s), ")
				.append(total.inputTokens()).append(" input / ").append(total.outputTokens()).append(" output tokens\n");
		return sb.toString();
	}

	private static void appendInteraction(StringBuilder sb, int number, AiInteraction interaction) {
		sb.append("\n## ").append(number).append(". ").append(interaction.operation().keyword());
		if (interaction.model() != null) {
			sb.append(" (").append(interaction.model()).append(')');
		}
		sb.append("\n\n");
		if (interaction.targetType() != null) {
			sb.append("- Target type: `").append(interaction.targetType().annotation()).append("`\n");
		}
		if (interaction.usage() != null) {
			sb.append("- Tokens: ").append(interaction.usage().inputTokens()).append(" in / ")
					.append(interaction.usage().outputTokens()).append(" out\n");
		}
		sb.append("- Duration: ").append(interaction.durationMillis()).append(" ms\n");
		sb.append("\n### Prompt\n\n").append(interaction.prompt()).append("\n");
		for (int r = 0; r < interaction.toolRounds().size(); r++) {
			ToolRound round = interaction.toolRounds().get(r);
			sb.append("\n### Tool round ").append(r + 1).append("\n\n");
			for (int c = 0; c < round.toolCalls().size(); c++) {
				ToolCall call = round.toolCalls().get(c);
				ToolResult result = c < round.results().size() ? round.results().get(c) : null;
				sb.append("- `").append(call.toolName()).append('(').append(call.arguments()).append(")`");
				if (result != null) {
					sb.append(result.failed() ? " failed: " : " -> ").append(result.failed() ? result.error() : result.asText());
				}
				sb.append('\n');
			}
		}
		sb.append("\n### Response\n\n```\n").append(interaction.response()).append("\n```\n");
	}
}
