package org.javai.springai.weave.state;

import java.util.Objects;
import org.javai.springai.weave.ast.Statement;

public record FunctionEntry(Statement.FunctionDecl declaration, FunctionOrigin origin) {

	public FunctionEntry {
		Objects.requireNonNull(declaration, "declaration must not be null");
		Objects.requireNonNull(origin, "origin must not be null");
	}

	public String name() {
		return declaration.name();
	}
}
