package org.javai.springai.weave.ast;

import java.util.List;

/**
 * A validated program as produced by the parser: an ordered list of
 * top-level statements.
 */
public record Program(List<Statement> statements) {

	public Program {
		statements = statements != null ? List.copyOf(statements) : List.of();
	}

	public static Program of(Statement... statements) {
		return new Program(List.of(statements));
	}
}
