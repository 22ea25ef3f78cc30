package org.javai.springai.weave.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.POJONode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Conversions and primitive operations over {@link Value}.
 */
public final class Values {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private Values() {
	}

	public static boolean isTruthy(Value value) {
		return switch (value.kind()) {
			case TEXT -> !((Value.Text) value).value().isEmpty();
			case NUMBER -> {
				double d = ((Value.Num) value).value();
				yield d != 0 && !Double.isNaN(d);
			}
			case BOOLEAN -> ((Value.Bool) value).value();
			case NULL -> false;
			case OPAQUE -> ((Value.Opaque) value).payload() != null;
			case JSON, ARRAY, MODEL, TOOL, FUNCTION -> true;
		};
	}

	/**
	 * Renders a value as display text, as used for string interpolation and
	 * program context. Integral numbers print without a fractional part.
	 */
	public static String render(Value value) {
		return switch (value.kind()) {
			case TEXT -> ((Value.Text) value).value();
			case NUMBER -> formatNumber(((Value.Num) value).value());
			case BOOLEAN -> String.valueOf(((Value.Bool) value).value());
			case NULL -> "null";
			case JSON -> ((Value.Json) value).node().toString();
			case ARRAY -> toJsonNode(value).toString();
			case MODEL -> ((Value.ModelRef) value).name();
			case TOOL -> ((Value.ToolRef) value).name();
			case FUNCTION -> ((Value.FunctionRef) value).name();
			case OPAQUE -> String.valueOf(((Value.Opaque) value).payload());
		};
	}

	public static String formatNumber(double d) {
		if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
			return String.valueOf((long) d);
		}
		return String.valueOf(d);
	}

	/**
	 * Short name of the runtime type of a value, for diagnostics.
	 */
	public static String typeName(Value value) {
		return switch (value.kind()) {
			case TEXT -> "text";
			case NUMBER -> "number";
			case BOOLEAN -> "boolean";
			case NULL -> "null";
			case JSON -> "json";
			case ARRAY -> "array";
			case MODEL -> "model";
			case TOOL -> "tool";
			case FUNCTION -> "function";
			case OPAQUE -> "opaque";
		};
	}

	public static boolean areEqual(Value left, Value right) {
		if (left instanceof Value.Num l && right instanceof Value.Num r) {
			return l.value() == r.value();
		}
		if (left.kind() == Value.Kind.ARRAY || left.kind() == Value.Kind.JSON) {
			if (right.kind() != Value.Kind.ARRAY && right.kind() != Value.Kind.JSON) {
				return false;
			}
			return toJsonNode(left).equals(toJsonNode(right));
		}
		return left.equals(right);
	}

	public static JsonNode toJsonNode(Value value) {
		return switch (value.kind()) {
			case TEXT -> NODES.textNode(((Value.Text) value).value());
			case NUMBER -> {
				double d = ((Value.Num) value).value();
				yield d == Math.rint(d) && Math.abs(d) < 1e15 ? NODES.numberNode((long) d) : NODES.numberNode(d);
			}
			case BOOLEAN -> NODES.booleanNode(((Value.Bool) value).value());
			case NULL -> NODES.nullNode();
			case JSON -> ((Value.Json) value).node().deepCopy();
			case ARRAY -> {
				ArrayNode array = NODES.arrayNode();
				for (Value element : ((Value.Array) value).elements()) {
					array.add(toJsonNode(element));
				}
				yield array;
			}
			case MODEL, TOOL, FUNCTION -> NODES.textNode(render(value));
			case OPAQUE -> NODES.pojoNode(((Value.Opaque) value).payload());
		};
	}

	/**
	 * Converts a JSON node to a value. Objects and arrays stay JSON; scalars
	 * become the matching scalar variant.
	 */
	public static Value fromJsonNode(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return Value.NULL;
		}
		if (node.isContainerNode()) {
			return new Value.Json(node);
		}
		if (node.isNumber()) {
			return Value.number(node.doubleValue());
		}
		if (node.isBoolean()) {
			return Value.bool(node.booleanValue());
		}
		if (node.isPojo()) {
			return fromJava(((POJONode) node).getPojo());
		}
		return Value.text(node.asText());
	}

	/**
	 * Converts a host object (tool result, host-code result) to a value.
	 * Objects with no JSON shape become {@link Value.Opaque}.
	 */
	public static Value fromJava(Object object) {
		if (object == null) {
			return Value.NULL;
		}
		if (object instanceof Value value) {
			return value;
		}
		if (object instanceof String s) {
			return Value.text(s);
		}
		if (object instanceof Number n) {
			return Value.number(n.doubleValue());
		}
		if (object instanceof Boolean b) {
			return Value.bool(b);
		}
		if (object instanceof JsonNode node) {
			return fromJsonNode(node);
		}
		if (object instanceof List<?> list) {
			List<Value> elements = new ArrayList<>(list.size());
			for (Object element : list) {
				elements.add(fromJava(element));
			}
			return Value.array(elements);
		}
		if (object instanceof Map<?, ?> map) {
			return new Value.Json(MAPPER.valueToTree(map));
		}
		return new Value.Opaque(object);
	}

	/**
	 * Converts the elements of a JSON array to values.
	 */
	public static List<Value> elementsOf(JsonNode array) {
		List<Value> elements = new ArrayList<>(array.size());
		Iterator<JsonNode> it = array.elements();
		while (it.hasNext()) {
			elements.add(fromJsonNode(it.next()));
		}
		return elements;
	}
}
