package org.javai.springai.weave.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies declared-type coercion to values bound into typed variables.
 *
 * <p>Text is accepted for every data type and parsed, since AI and user
 * responses always arrive as text. A value that cannot be converted raises
 * {@link TypeCoercionException}; nothing is ever stored untyped.</p>
 */
public final class TypeCoercion {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private TypeCoercion() {
	}

	/**
	 * Coerces {@code value} to the type named by {@code annotation}. A
	 * {@code null} annotation or {@link Value#NULL} passes through unchanged.
	 */
	public static Value coerce(Value value, String annotation) {
		if (annotation == null || value.kind() == Value.Kind.NULL) {
			return value;
		}
		if ("model".equals(annotation)) {
			if (value.kind() != Value.Kind.MODEL) {
				throw mismatch(annotation, value);
			}
			return value;
		}
		if ("prompt".equals(annotation)) {
			return requireText(value, annotation);
		}
		TargetType target = TargetType.fromAnnotation(annotation);
		return target != null ? coerce(value, target) : value;
	}

	public static Value coerce(Value value, TargetType target) {
		if (value.kind() == Value.Kind.NULL) {
			return value;
		}
		if (target.isArray()) {
			return coerceArray(value, target);
		}
		return switch (target) {
			case TEXT -> requireText(value, target.annotation());
			case NUMBER -> coerceNumber(value);
			case BOOLEAN -> coerceBoolean(value);
			default -> coerceJson(value);
		};
	}

	/**
	 * Parses a raw response string for the given target type. Without a target
	 * type the response is kept as text.
	 */
	public static Value parseResponse(String content, TargetType target) {
		Value text = Value.text(content);
		return target == null ? text : coerce(text, target);
	}

	private static Value requireText(Value value, String annotation) {
		if (value.kind() != Value.Kind.TEXT) {
			throw mismatch(annotation, value);
		}
		return value;
	}

	private static Value coerceNumber(Value value) {
		double number;
		if (value instanceof Value.Num num) {
			number = num.value();
		}
		else if (value instanceof Value.Text text) {
			String trimmed = text.value().trim();
			try {
				number = Double.parseDouble(trimmed);
			}
			catch (NumberFormatException e) {
				throw new TypeCoercionException("number", "Failed to parse response as number: \"" + trimmed + "\"");
			}
		}
		else {
			throw mismatch("number", value);
		}
		if (!Double.isFinite(number)) {
			throw new TypeCoercionException("number", "Expected a finite number but got " + number);
		}
		return Value.number(number);
	}

	private static Value coerceBoolean(Value value) {
		if (value.kind() == Value.Kind.BOOLEAN) {
			return value;
		}
		if (value instanceof Value.Text text) {
			String lower = text.value().trim().toLowerCase();
			if ("true".equals(lower)) {
				return Value.bool(true);
			}
			if ("false".equals(lower)) {
				return Value.bool(false);
			}
			throw new TypeCoercionException("boolean", "Failed to parse response as boolean: \"" + text.value().trim() + "\"");
		}
		throw mismatch("boolean", value);
	}

	private static Value coerceJson(Value value) {
		return switch (value.kind()) {
			case JSON -> value;
			case ARRAY -> new Value.Json(Values.toJsonNode(value));
			case TEXT -> {
				JsonNode node = parseJson(((Value.Text) value).value(), "json");
				if (!node.isContainerNode()) {
					throw new TypeCoercionException("json", "Expected a JSON object or array but got " + node.getNodeType());
				}
				yield new Value.Json(node);
			}
			default -> throw mismatch("json", value);
		};
	}

	private static Value coerceArray(Value value, TargetType target) {
		List<Value> source;
		if (value instanceof Value.Array array) {
			source = array.elements();
		}
		else if (value instanceof Value.Json json && json.node().isArray()) {
			source = Values.elementsOf(json.node());
		}
		else if (value instanceof Value.Text text) {
			JsonNode node = parseJson(text.value(), target.annotation());
			if (!node.isArray()) {
				throw new TypeCoercionException(target.annotation(), "Expected array, got " + node.getNodeType());
			}
			source = Values.elementsOf(node);
		}
		else {
			throw mismatch(target.annotation(), value);
		}
		TargetType elementType = target.elementType();
		List<Value> coerced = new ArrayList<>(source.size());
		for (Value element : source) {
			coerced.add(coerce(element, elementType));
		}
		return Value.array(coerced);
	}

	private static JsonNode parseJson(String content, String annotation) {
		String trimmed = content.trim();
		try {
			return MAPPER.readTree(trimmed);
		}
		catch (JsonProcessingException e) {
			throw new TypeCoercionException(annotation, "Failed to parse response as " + annotation + ": \"" + trimmed + "\"");
		}
	}

	private static TypeCoercionException mismatch(String annotation, Value value) {
		return new TypeCoercionException(annotation,
				"Cannot assign a " + Values.typeName(value) + " value to a variable of type " + annotation);
	}
}
