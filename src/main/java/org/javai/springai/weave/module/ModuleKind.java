package org.javai.springai.weave.module;

public enum ModuleKind {
	/** A module written in the orchestration language itself. */
	LANGUAGE,
	/** A module implemented by the host and evaluated on first access. */
	HOST
}
