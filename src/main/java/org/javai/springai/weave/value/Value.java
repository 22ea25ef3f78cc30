package org.javai.springai.weave.value;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * A runtime value of the orchestration language.
 *
 * <p>The value domain is closed: every consumer switches over {@link #kind()}
 * and handles each variant. Model, tool and function references are ordinary
 * values so they can be stored in variables, passed as arguments and
 * serialized with the rest of the state.</p>
 */
public sealed interface Value
		permits Value.Text, Value.Num, Value.Bool, Value.Null, Value.Json, Value.Array,
		Value.ModelRef, Value.ToolRef, Value.FunctionRef, Value.Opaque {

	Value NULL = new Null();

	enum Kind {
		TEXT, NUMBER, BOOLEAN, NULL, JSON, ARRAY, MODEL, TOOL, FUNCTION, OPAQUE
	}

	Kind kind();

	static Value text(String value) {
		return new Text(value);
	}

	static Value number(double value) {
		return new Num(value);
	}

	static Value bool(boolean value) {
		return new Bool(value);
	}

	static Value array(List<Value> elements) {
		return new Array(elements);
	}

	record Text(String value) implements Value {
		public Text {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public Kind kind() {
			return Kind.TEXT;
		}
	}

	record Num(double value) implements Value {
		@Override
		public Kind kind() {
			return Kind.NUMBER;
		}
	}

	record Bool(boolean value) implements Value {
		@Override
		public Kind kind() {
			return Kind.BOOLEAN;
		}
	}

	record Null() implements Value {
		@Override
		public Kind kind() {
			return Kind.NULL;
		}
	}

	/**
	 * A JSON object or array. Scalars read out of a JSON document are converted
	 * to the matching scalar variant instead.
	 */
	record Json(JsonNode node) implements Value {
		public Json {
			Objects.requireNonNull(node, "node must not be null");
			if (!node.isContainerNode()) {
				throw new IllegalArgumentException("json values must be an object or an array, got " + node.getNodeType());
			}
			node = node.deepCopy();
		}

		@Override
		public Kind kind() {
			return Kind.JSON;
		}
	}

	record Array(List<Value> elements) implements Value {
		public Array {
			elements = List.copyOf(elements);
		}

		@Override
		public Kind kind() {
			return Kind.ARRAY;
		}
	}

	/**
	 * A model declared by the program. {@code tools} lists the tool names the
	 * model may call; an empty list disables tool calling.
	 */
	record ModelRef(String name, String modelName, String provider, String url, String apiKeyEnv,
			Integer maxRetriesOnError, List<String> tools) implements Value {
		public ModelRef {
			Objects.requireNonNull(name, "name must not be null");
			tools = tools != null ? List.copyOf(tools) : List.of();
		}

		@Override
		public Kind kind() {
			return Kind.MODEL;
		}
	}

	record ToolRef(String name) implements Value {
		public ToolRef {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public Kind kind() {
			return Kind.TOOL;
		}
	}

	/**
	 * Reference to a function. {@code modulePath} is {@code null} for functions
	 * of the entry program, otherwise the resolved path of the defining module.
	 */
	record FunctionRef(String name, String modulePath) implements Value {
		public FunctionRef {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public Kind kind() {
			return Kind.FUNCTION;
		}
	}

	/**
	 * A host object returned by host code. It can flow through a running
	 * program but has no durable encoding.
	 */
	record Opaque(Object payload) implements Value {
		@Override
		public Kind kind() {
			return Kind.OPAQUE;
		}
	}
}
