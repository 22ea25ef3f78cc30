package org.javai.springai.weave.ai;

/**
 * Token accounting reported by a provider for one or more requests.
 */
public record TokenUsage(int inputTokens, int outputTokens) {

	public static final TokenUsage NONE = new TokenUsage(0, 0);

	public TokenUsage plus(TokenUsage other) {
		if (other == null) {
			return this;
		}
		return new TokenUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
	}

	public int totalTokens() {
		return inputTokens + outputTokens;
	}
}
