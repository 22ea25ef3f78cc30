package org.javai.springai.weave.ai;

/**
 * Why the model stopped generating.
 */
public enum StopReason {
	END,
	TOOL_USE,
	LENGTH,
	CONTENT_FILTER
}
