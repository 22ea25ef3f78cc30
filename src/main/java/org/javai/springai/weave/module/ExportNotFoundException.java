package org.javai.springai.weave.module;

import org.javai.springai.weave.WeaveException;

public class ExportNotFoundException extends WeaveException {

	private final String modulePath;
	private final String exportName;

	public ExportNotFoundException(String modulePath, String exportName) {
		super("'" + exportName + "' is not exported from '" + modulePath + "'");
		this.modulePath = modulePath;
		this.exportName = exportName;
	}

	public String modulePath() {
		return modulePath;
	}

	public String exportName() {
		return exportName;
	}

	@Override
	public String errorType() {
		return "ExportNotFound";
	}
}
