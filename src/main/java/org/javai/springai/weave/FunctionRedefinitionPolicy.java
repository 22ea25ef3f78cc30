package org.javai.springai.weave;

/**
 * What happens when {@code vibe}-generated code declares a function whose
 * name is already in the function table.
 */
public enum FunctionRedefinitionPolicy {

	/** Any clash is a {@link FunctionRedefinitionException}. */
	REJECT,

	/** The generated function replaces the existing one. */
	OVERWRITE,

	/**
	 * Generated functions may replace earlier generated functions, never
	 * functions written in the program.
	 */
	OVERWRITE_GENERATED
}
