package org.javai.springai.weave.exec;

public enum UnwindKind {
	RETURN,
	BREAK,
	CONTINUE
}
