package org.javai.springai.weave.tool;

import java.util.Objects;
import org.javai.springai.weave.value.Value;
import org.javai.springai.weave.value.Values;

/**
 * Outcome of one tool call. Exactly one of {@code value} and {@code error} is
 * set.
 */
public record ToolResult(String callId, Value value, String error) {

	public ToolResult {
		Objects.requireNonNull(callId, "callId must not be null");
		if ((value == null) == (error == null)) {
			throw new IllegalArgumentException("a tool result carries either a value or an error");
		}
	}

	public static ToolResult success(String callId, Value value) {
		return new ToolResult(callId, value, null);
	}

	public static ToolResult failure(String callId, String error) {
		return new ToolResult(callId, null, error != null ? error : "Unknown error");
	}

	public boolean failed() {
		return error != null;
	}

	/**
	 * Text fed back to the model for this result.
	 */
	public String asText() {
		return failed() ? "Error: " + error : Values.render(value);
	}
}
