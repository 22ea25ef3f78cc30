package org.javai.springai.weave.ast;

import java.util.Objects;

/**
 * A function parameter with an optional type annotation.
 */
public record Parameter(String name, String type) {

	public Parameter {
		Objects.requireNonNull(name, "name must not be null");
	}
}
