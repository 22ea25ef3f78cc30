package org.javai.springai.weave.ast;

public enum BinaryOperator {

	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	MODULO("%"),
	EQUAL("=="),
	NOT_EQUAL("!="),
	LESS("<"),
	LESS_EQUAL("<="),
	GREATER(">"),
	GREATER_EQUAL(">="),
	AND("and"),
	OR("or");

	private final String symbol;

	BinaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public boolean isShortCircuit() {
		return this == AND || this == OR;
	}
}
