package org.javai.springai.weave.value;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The structured-output shape an AI response must have, derived from the
 * declared type of the variable receiving it.
 */
public enum TargetType {

	TEXT("text"),
	NUMBER("number"),
	BOOLEAN("boolean"),
	JSON("json"),
	TEXT_ARRAY("text[]"),
	NUMBER_ARRAY("number[]"),
	BOOLEAN_ARRAY("boolean[]"),
	JSON_ARRAY("json[]");

	private static final String RAW_JSON_INSTRUCTION =
			"Respond with raw JSON only. No markdown, no code fences, no explanation. Just the JSON starting with { or [.";

	private final String annotation;

	TargetType(String annotation) {
		this.annotation = annotation;
	}

	/**
	 * The type annotation as written in programs, e.g. {@code number[]}.
	 */
	public String annotation() {
		return annotation;
	}

	public boolean isArray() {
		return annotation.endsWith("[]");
	}

	/**
	 * The element type of an array type, or this type itself.
	 */
	public TargetType elementType() {
		return switch (this) {
			case TEXT_ARRAY -> TEXT;
			case NUMBER_ARRAY -> NUMBER;
			case BOOLEAN_ARRAY -> BOOLEAN;
			case JSON_ARRAY -> JSON;
			default -> this;
		};
	}

	/**
	 * Maps a declared type annotation to a target type. Annotations that do not
	 * describe data ({@code model}, {@code prompt}) and missing annotations map
	 * to {@code null}, meaning "no structured output required".
	 */
	public static TargetType fromAnnotation(String annotation) {
		if (annotation == null) {
			return null;
		}
		for (TargetType type : values()) {
			if (type.annotation.equals(annotation)) {
				return type;
			}
		}
		return null;
	}

	/**
	 * JSON schema fragment for providers that enforce structured output.
	 */
	public ObjectNode schema() {
		ObjectNode schema = JsonNodeFactory.instance.objectNode();
		if (isArray()) {
			schema.put("type", "array");
			schema.set("items", elementType().schema());
			return schema;
		}
		switch (this) {
			case TEXT -> schema.put("type", "string");
			case NUMBER -> schema.put("type", "number");
			case BOOLEAN -> schema.put("type", "boolean");
			default -> {
				schema.put("type", "object");
				schema.put("additionalProperties", true);
			}
		}
		return schema;
	}

	/**
	 * Instruction appended to the prompt for providers without structured
	 * output; {@code null} for plain text.
	 */
	public String instruction() {
		return switch (this) {
			case TEXT -> null;
			case NUMBER -> "Respond with a number only. No units, no text, just the numeric value.";
			case BOOLEAN -> "Respond with exactly \"true\" or \"false\". Nothing else.";
			case JSON, JSON_ARRAY -> RAW_JSON_INSTRUCTION;
			case TEXT_ARRAY, NUMBER_ARRAY, BOOLEAN_ARRAY ->
					"Respond with a JSON array of " + elementType().annotation + " values only. No additional text.";
		};
	}

	/**
	 * JSON-typed targets always need the textual instruction because a schema
	 * cannot describe their unknown shape.
	 */
	public boolean requiresInstruction() {
		return this == JSON || this == JSON_ARRAY;
	}
}
