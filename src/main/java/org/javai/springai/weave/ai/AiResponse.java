package org.javai.springai.weave.ai;

import java.util.List;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.value.Value;

/**
 * A provider's answer to one {@link AiRequest}.
 *
 * @param content raw text content, empty when the model only called tools
 * @param parsedValue the content already parsed by a provider with structured output, or {@code null}
 * @param usage token usage, {@link TokenUsage#NONE} when the provider reports none
 * @param toolCalls tool calls the model asked for
 * @param stopReason why generation stopped
 */
public record AiResponse(
		String content,
		Value parsedValue,
		TokenUsage usage,
		List<ToolCall> toolCalls,
		StopReason stopReason
) {

	public AiResponse {
		content = content != null ? content : "";
		usage = usage != null ? usage : TokenUsage.NONE;
		toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
		if (stopReason == null) {
			stopReason = toolCalls.isEmpty() ? StopReason.END : StopReason.TOOL_USE;
		}
	}

	public static AiResponse text(String content) {
		return new AiResponse(content, null, TokenUsage.NONE, List.of(), StopReason.END);
	}

	public static AiResponse toolUse(List<ToolCall> toolCalls) {
		return new AiResponse("", null, TokenUsage.NONE, toolCalls, StopReason.TOOL_USE);
	}

	public boolean hasToolCalls() {
		return !toolCalls.isEmpty();
	}
}
