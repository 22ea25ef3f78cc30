package org.javai.springai.weave;

/**
 * Generated code tried to redefine a function the active
 * {@link FunctionRedefinitionPolicy} protects.
 */
public class FunctionRedefinitionException extends WeaveException {

	private final String functionName;

	public FunctionRedefinitionException(String functionName, FunctionRedefinitionPolicy policy) {
		super("Generated function '" + functionName + "' would redefine an existing function (policy " + policy + ")");
		this.functionName = functionName;
	}

	public String functionName() {
		return functionName;
	}

	@Override
	public String errorType() {
		return "FunctionRedefinition";
	}
}
