package org.javai.springai.weave.value;

import org.javai.springai.weave.WeaveException;

/**
 * A value could not be converted to the type a variable was declared with.
 */
public class TypeCoercionException extends WeaveException {

	private final String expectedType;

	public TypeCoercionException(String expectedType, String message) {
		super(message);
		this.expectedType = expectedType;
	}

	public String expectedType() {
		return expectedType;
	}

	@Override
	public String errorType() {
		return "TypeCoercion";
	}
}
