package org.javai.springai.weave.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import org.javai.springai.weave.state.AiInteraction;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolResult;
import org.javai.springai.weave.value.TargetType;
import org.javai.springai.weave.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AiInteractionFormatter")
class AiInteractionFormatterTest {

	@Test
	@DisplayName("should say so when there were no interactions")
	void shouldFormatEmptyLog() {
		assertThat(AiInteractionFormatter.format(List.of())).isEqualTo("# AI Interactions\n\n_No interactions._\n");
	}

	@Test
	@DisplayName("should list each interaction with its tool rounds and a token total")
	void shouldFormatInteractions() {
		// Given
		ToolCall call = new ToolCall("c1", "lookup", JsonNodeFactory.instance.objectNode().put("key", "a"));
		ToolRound round = new ToolRound(List.of(call), List.of(ToolResult.success("c1", Value.text("found"))));
		AiInteraction first = new AiInteraction(AiOperation.DO, "2+2", "default", TargetType.NUMBER, "4",
				new TokenUsage(10, 2), List.of(round), 15);
		AiInteraction second = new AiInteraction(AiOperation.ASK, "Name?", null, null, "Ada", TokenUsage.NONE,
				List.of(), 0);

		// When
		String markdown = AiInteractionFormatter.format(List.of(first, second));

		// Then
		assertThat(markdown).contains(
				"## 1. do (default)",
				"- Target type: `number`",
				"- Tokens: 10 in / 2 out",
				"### Tool round 1",
				"- `lookup({\"key\":\"a\"})` -> found",
				"```\n4\n```",
				"## 2. ask\n",
				"Total: 2 interaction(s), 10 input / 2 output tokens");
	}
}
