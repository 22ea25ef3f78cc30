package org.javai.springai.weave.state;

public enum RuntimeStatus {

	RUNNING,
	AWAITING_AI,
	AWAITING_USER,
	AWAITING_TOOL_EVAL,
	AWAITING_HOST_EVAL,
	COMPLETED,
	ERROR;

	public boolean isAwaiting() {
		return this == AWAITING_AI || this == AWAITING_USER || this == AWAITING_TOOL_EVAL || this == AWAITING_HOST_EVAL;
	}

	public boolean isTerminal() {
		return this == COMPLETED || this == ERROR;
	}
}
