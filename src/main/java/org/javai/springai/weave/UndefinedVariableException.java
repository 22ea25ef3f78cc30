package org.javai.springai.weave;

/**
 * A name was read or assigned that is not bound in any frame, function table,
 * import table or tool registry.
 */
public class UndefinedVariableException extends WeaveException {

	private final String name;

	public UndefinedVariableException(String name) {
		super("'" + name + "' is not defined");
		this.name = name;
	}

	public String name() {
		return name;
	}

	@Override
	public String errorType() {
		return "UndefinedVariable";
	}
}
