package org.javai.springai.weave.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * A request to run one tool, either from the model or from program code.
 *
 * @param id identifier results are paired back by
 * @param toolName the registered tool name
 * @param arguments a JSON object of named arguments
 */
public record ToolCall(String id, String toolName, JsonNode arguments) {

	public ToolCall {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(toolName, "toolName must not be null");
		arguments = arguments != null ? arguments.deepCopy() : JsonNodeFactory.instance.objectNode();
	}
}
