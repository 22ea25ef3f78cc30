package org.javai.springai.weave.ast;

public enum UnaryOperator {
	NOT,
	NEGATE
}
