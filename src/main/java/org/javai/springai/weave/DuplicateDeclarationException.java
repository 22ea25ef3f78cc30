package org.javai.springai.weave;

/**
 * A declaration reused a name that already exists in the current frame.
 */
public class DuplicateDeclarationException extends WeaveException {

	private final String name;

	public DuplicateDeclarationException(String name, String frameName) {
		super("Variable '" + name + "' is already declared in '" + frameName + "'");
		this.name = name;
	}

	public String name() {
		return name;
	}

	@Override
	public String errorType() {
		return "DuplicateDeclaration";
	}
}
