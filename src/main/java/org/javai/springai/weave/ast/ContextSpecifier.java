package org.javai.springai.weave.ast;

/**
 * Chooses which program context accompanies an AI or user request.
 *
 * <ul>
 *   <li>{@code DEFAULT}: every live frame, outermost first</li>
 *   <li>{@code LOCAL}: the innermost frame only</li>
 *   <li>{@code VARIABLE}: the rendered value of the named variable</li>
 * </ul>
 */
public record ContextSpecifier(Kind kind, String variable) {

	public enum Kind {
		DEFAULT, LOCAL, VARIABLE
	}

	private static final ContextSpecifier DEFAULT = new ContextSpecifier(Kind.DEFAULT, null);
	private static final ContextSpecifier LOCAL = new ContextSpecifier(Kind.LOCAL, null);

	public ContextSpecifier {
		if (kind == null) {
			kind = Kind.DEFAULT;
		}
		if (kind == Kind.VARIABLE && variable == null) {
			throw new IllegalArgumentException("a variable context needs a variable name");
		}
	}

	public static ContextSpecifier defaultContext() {
		return DEFAULT;
	}

	public static ContextSpecifier local() {
		return LOCAL;
	}

	public static ContextSpecifier variable(String name) {
		return new ContextSpecifier(Kind.VARIABLE, name);
	}
}
