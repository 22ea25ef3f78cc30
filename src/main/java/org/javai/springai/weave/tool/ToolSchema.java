package org.javai.springai.weave.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Name, description and JSON input schema of a tool, as advertised to the
 * model.
 */
public record ToolSchema(String name, String description, ObjectNode inputSchema) {

	public ToolSchema {
		Objects.requireNonNull(name, "name must not be null");
		description = description != null ? description : "";
		inputSchema = inputSchema != null ? inputSchema.deepCopy() : emptySchema();
	}

	/**
	 * Parameter names in declaration order. Positional arguments in a direct
	 * call from program code are matched against this order.
	 */
	public List<String> parameterNames() {
		List<String> names = new ArrayList<>();
		JsonNode properties = inputSchema.get("properties");
		if (properties != null) {
			Iterator<String> it = properties.fieldNames();
			while (it.hasNext()) {
				names.add(it.next());
			}
		}
		return names;
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	private static ObjectNode emptySchema() {
		ObjectNode schema = JsonNodeFactory.instance.objectNode();
		schema.put("type", "object");
		schema.putObject("properties");
		return schema;
	}

	public static final class Builder {
		private final String name;
		private String description;
		private final ObjectNode schema = emptySchema();
		private final ArrayNode required = JsonNodeFactory.instance.arrayNode();

		private Builder(String name) {
			this.name = name;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		/**
		 * Adds a parameter with a JSON schema type such as {@code string}.
		 */
		public Builder parameter(String parameterName, String type, String parameterDescription, boolean isRequired) {
			ObjectNode property = ((ObjectNode) schema.get("properties")).putObject(parameterName);
			property.put("type", type);
			if (parameterDescription != null) {
				property.put("description", parameterDescription);
			}
			if (isRequired) {
				required.add(parameterName);
			}
			return this;
		}

		public ToolSchema build() {
			ObjectNode result = schema.deepCopy();
			if (!required.isEmpty()) {
				result.set("required", required.deepCopy());
			}
			return new ToolSchema(name, description, result);
		}
	}
}
