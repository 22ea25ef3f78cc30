package org.javai.springai.weave.module;

import org.javai.springai.weave.WeaveException;

/**
 * Two imports, or an import and a top-level declaration, claim the same local name.
 */
public class ImportConflictException extends WeaveException {

	private final String localName;

	public ImportConflictException(String localName, String message) {
		super(message);
		this.localName = localName;
	}

	public String localName() {
		return localName;
	}

	@Override
	public String errorType() {
		return "ImportConflict";
	}
}
