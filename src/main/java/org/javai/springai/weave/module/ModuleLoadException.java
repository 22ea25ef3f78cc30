package org.javai.springai.weave.module;

import org.javai.springai.weave.WeaveException;

/**
 * A module source could not be read or parsed.
 */
public class ModuleLoadException extends WeaveException {

	private final String modulePath;

	public ModuleLoadException(String modulePath, String message) {
		super(message);
		this.modulePath = modulePath;
	}

	public ModuleLoadException(String modulePath, String message, Throwable cause) {
		super(message, cause);
		this.modulePath = modulePath;
	}

	public String modulePath() {
		return modulePath;
	}

	@Override
	public String errorType() {
		return "ModuleLoad";
	}
}
