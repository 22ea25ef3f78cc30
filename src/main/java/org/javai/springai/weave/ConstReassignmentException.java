package org.javai.springai.weave;

/**
 * An assignment targeted a {@code const} binding.
 */
public class ConstReassignmentException extends WeaveException {

	private final String name;

	public ConstReassignmentException(String name) {
		super("Cannot assign to constant '" + name + "'");
		this.name = name;
	}

	public String name() {
		return name;
	}

	@Override
	public String errorType() {
		return "ConstReassignment";
	}
}
