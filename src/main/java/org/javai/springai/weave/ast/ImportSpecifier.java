package org.javai.springai.weave.ast;

import java.util.Objects;

/**
 * One name in an import statement, optionally renamed with {@code as}.
 */
public record ImportSpecifier(String name, String alias) {

	public ImportSpecifier {
		Objects.requireNonNull(name, "name must not be null");
	}

	/**
	 * The name the import binds in the importing program.
	 */
	public String localName() {
		return alias != null ? alias : name;
	}
}
