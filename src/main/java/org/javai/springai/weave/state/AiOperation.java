package org.javai.springai.weave.state;

/**
 * The kinds of suspended AI or user operation.
 */
public enum AiOperation {

	DO("do"),
	VIBE("vibe"),
	ASK("ask"),
	COMPRESS("compress");

	private final String keyword;

	AiOperation(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}
}
