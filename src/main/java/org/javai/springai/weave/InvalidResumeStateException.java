package org.javai.springai.weave;

import org.javai.springai.weave.state.RuntimeStatus;

/**
 * A resume call did not match the kind of request the state is suspended on.
 */
public class InvalidResumeStateException extends WeaveException {

	private final RuntimeStatus expected;
	private final RuntimeStatus actual;

	public InvalidResumeStateException(RuntimeStatus expected, RuntimeStatus actual) {
		super("Cannot resume: expected status " + expected + " but state is " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public InvalidResumeStateException(String message, RuntimeStatus actual) {
		super(message);
		this.expected = null;
		this.actual = actual;
	}

	public RuntimeStatus expected() {
		return expected;
	}

	public RuntimeStatus actual() {
		return actual;
	}

	@Override
	public String errorType() {
		return "InvalidResumeState";
	}
}
