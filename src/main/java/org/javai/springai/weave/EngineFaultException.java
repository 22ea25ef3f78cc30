package org.javai.springai.weave;

/**
 * A runtime fault in program logic that has no more specific category:
 * calling a non-function, {@code break} outside a loop, a bad operand type.
 */
public class EngineFaultException extends WeaveException {

	public EngineFaultException(String message) {
		super(message);
	}

	@Override
	public String errorType() {
		return "EngineFault";
	}
}
