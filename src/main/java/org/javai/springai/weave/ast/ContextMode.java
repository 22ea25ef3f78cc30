package org.javai.springai.weave.ast;

/**
 * What happens to a loop's accumulated frame entries when the loop exits.
 *
 * <p>{@code COMPRESS} may name its own summarization prompt and model; when
 * absent the engine defaults apply.</p>
 */
public record ContextMode(Mode mode, String compressPrompt, String compressModel) {

	public enum Mode {
		VERBOSE, FORGET, COMPRESS
	}

	private static final ContextMode VERBOSE = new ContextMode(Mode.VERBOSE, null, null);
	private static final ContextMode FORGET = new ContextMode(Mode.FORGET, null, null);

	public ContextMode {
		if (mode == null) {
			mode = Mode.VERBOSE;
		}
	}

	public static ContextMode verbose() {
		return VERBOSE;
	}

	public static ContextMode forget() {
		return FORGET;
	}

	public static ContextMode compress() {
		return new ContextMode(Mode.COMPRESS, null, null);
	}

	public static ContextMode compress(String prompt, String model) {
		return new ContextMode(Mode.COMPRESS, prompt, model);
	}
}
