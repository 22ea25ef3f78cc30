package org.javai.springai.weave.ai;

import java.util.List;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolResult;

/**
 * One round of a tool-calling conversation: the calls the model asked for
 * and their results, in call order.
 */
public record ToolRound(List<ToolCall> toolCalls, List<ToolResult> results) {

	public ToolRound {
		toolCalls = List.copyOf(toolCalls);
		results = List.copyOf(results);
	}
}
