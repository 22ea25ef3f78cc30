package org.javai.springai.weave.state;

/**
 * Where a function in the function table came from.
 */
public enum FunctionOrigin {
	PROGRAM,
	GENERATED,
	MODULE
}
