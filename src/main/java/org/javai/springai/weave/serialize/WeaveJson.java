package org.javai.springai.weave.serialize;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.javai.springai.weave.value.Value;

/**
 * Jackson setup shared by the state serializer and the JSON program and
 * fragment parsers.
 *
 * <p>Values are written as tagged objects, e.g.
 * {@code {"type":"number","value":4}}. Opaque host values and non-finite
 * numbers have no encoding and raise
 * {@link RuntimeStateSerializer.UnsupportedValueException}.</p>
 */
public final class WeaveJson {

	private WeaveJson() {
	}

	public static ObjectMapper mapper() {
		SimpleModule values = new SimpleModule("weave-values");
		values.addSerializer(Value.class, new ValueSerializer());
		values.addDeserializer(Value.class, new ValueDeserializer());
		return new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.registerModule(values)
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
				.configure(SerializationFeature.WRAP_EXCEPTIONS, false)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	/**
	 * Encodes a value as a tagged JSON object.
	 */
	public static ObjectNode encode(Value value) {
		ObjectNode node = JsonNodeFactory.instance.objectNode();
		switch (value.kind()) {
			case TEXT -> node.put("type", "text").put("value", ((Value.Text) value).value());
			case NUMBER -> {
				double d = ((Value.Num) value).value();
				if (!Double.isFinite(d)) {
					throw new RuntimeStateSerializer.UnsupportedValueException("Cannot serialize non-finite number " + d);
				}
				node.put("type", "number").put("value", d);
			}
			case BOOLEAN -> node.put("type", "boolean").put("value", ((Value.Bool) value).value());
			case NULL -> node.put("type", "null");
			case JSON -> {
				node.put("type", "json");
				node.set("value", ((Value.Json) value).node().deepCopy());
			}
			case ARRAY -> {
				node.put("type", "array");
				ArrayNode elements = node.putArray("value");
				for (Value element : ((Value.Array) value).elements()) {
					elements.add(encode(element));
				}
			}
			case MODEL -> {
				Value.ModelRef model = (Value.ModelRef) value;
				node.put("type", "model").put("name", model.name());
				putIfPresent(node, "modelName", model.modelName());
				putIfPresent(node, "provider", model.provider());
				putIfPresent(node, "url", model.url());
				putIfPresent(node, "apiKeyEnv", model.apiKeyEnv());
				if (model.maxRetriesOnError() != null) {
					node.put("maxRetriesOnError", model.maxRetriesOnError());
				}
				ArrayNode tools = node.putArray("tools");
				model.tools().forEach(tools::add);
			}
			case TOOL -> node.put("type", "tool").put("name", ((Value.ToolRef) value).name());
			case FUNCTION -> {
				Value.FunctionRef function = (Value.FunctionRef) value;
				node.put("type", "function").put("name", function.name());
				putIfPresent(node, "modulePath", function.modulePath());
			}
			case OPAQUE -> throw new RuntimeStateSerializer.UnsupportedValueException(
					"Cannot serialize opaque host value of type "
							+ describe(((Value.Opaque) value).payload()));
		}
		return node;
	}

	/**
	 * Decodes a tagged JSON object produced by {@link #encode(Value)}.
	 */
	public static Value decode(JsonNode node) {
		String type = node.path("type").asText();
		return switch (type) {
			case "text" -> Value.text(node.path("value").asText());
			case "number" -> Value.number(node.path("value").asDouble());
			case "boolean" -> Value.bool(node.path("value").asBoolean());
			case "null" -> Value.NULL;
			case "json" -> new Value.Json(node.get("value"));
			case "array" -> {
				List<Value> elements = new ArrayList<>();
				for (JsonNode element : node.path("value")) {
					elements.add(decode(element));
				}
				yield Value.array(elements);
			}
			case "model" -> {
				List<String> tools = new ArrayList<>();
				node.path("tools").forEach(t -> tools.add(t.asText()));
				yield new Value.ModelRef(node.path("name").asText(), textOrNull(node, "modelName"),
						textOrNull(node, "provider"), textOrNull(node, "url"), textOrNull(node, "apiKeyEnv"),
						node.hasNonNull("maxRetriesOnError") ? node.get("maxRetriesOnError").asInt() : null, tools);
			}
			case "tool" -> new Value.ToolRef(node.path("name").asText());
			case "function" -> new Value.FunctionRef(node.path("name").asText(), textOrNull(node, "modulePath"));
			default -> throw new IllegalArgumentException("Unknown value type '" + type + "'");
		};
	}

	private static void putIfPresent(ObjectNode node, String field, String value) {
		if (value != null) {
			node.put(field, value);
		}
	}

	private static String textOrNull(JsonNode node, String field) {
		JsonNode child = node.get(field);
		return child != null && !child.isNull() ? child.asText() : null;
	}

	private static String describe(Object payload) {
		return payload == null ? "null" : payload.getClass().getName();
	}

	static class ValueSerializer extends JsonSerializer<Value> {
		@Override
		public void serialize(Value value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeTree(encode(value));
		}
	}

	static class ValueDeserializer extends JsonDeserializer<Value> {
		@Override
		public Value deserialize(JsonParser parser, DeserializationContext context) throws IOException {
			JsonNode node = parser.readValueAsTree();
			return decode(node);
		}
	}
}
