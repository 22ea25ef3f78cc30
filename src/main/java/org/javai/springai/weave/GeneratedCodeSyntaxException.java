package org.javai.springai.weave;

/**
 * Code returned by the model for a {@code vibe} request could not be parsed
 * as a function declaration. Never retried automatically.
 */
public class GeneratedCodeSyntaxException extends WeaveException {

	private final String source;

	public GeneratedCodeSyntaxException(String message, String source) {
		super(message);
		this.source = source;
	}

	public GeneratedCodeSyntaxException(String message, String source, Throwable cause) {
		super(message, cause);
		this.source = source;
	}

	/**
	 * The generated text that failed to parse.
	 */
	public String source() {
		return source;
	}

	@Override
	public String errorType() {
		return "GeneratedCodeSyntax";
	}
}
