package org.javai.springai.weave.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.Map;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Exposes a Spring AI {@link ToolCallback}, typically a {@code @Tool}-annotated
 * bean method, as an engine {@link Tool}.
 *
 * <p>Callback results are JSON text; they are parsed back into JSON when
 * possible so structured results keep their shape.</p>
 */
public class ToolCallbackTool implements Tool {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final ToolCallback callback;
	private final ToolSchema schema;

	public ToolCallbackTool(ToolCallback callback) {
		this.callback = callback;
		ToolDefinition definition = callback.getToolDefinition();
		this.schema = new ToolSchema(definition.name(), definition.description(), parseSchema(definition.name(), definition.inputSchema()));
	}

	@Override
	public ToolSchema schema() {
		return schema;
	}

	@Override
	public Object execute(JsonNode arguments, ToolExecutionContext context) throws Exception {
		Map<String, Object> toolContext = new HashMap<>(context.attributes());
		if (context.workingDirectory() != null) {
			toolContext.put("workingDirectory", context.workingDirectory().toString());
		}
		String result = toolContext.isEmpty()
				? callback.call(arguments.toString())
				: callback.call(arguments.toString(), new ToolContext(toolContext));
		if (result == null) {
			return null;
		}
		try {
			return MAPPER.readTree(result);
		}
		catch (JsonProcessingException e) {
			return result;
		}
	}

	private static ObjectNode parseSchema(String toolName, String inputSchema) {
		if (inputSchema == null || inputSchema.isBlank()) {
			return null;
		}
		try {
			JsonNode node = MAPPER.readTree(inputSchema);
			return node instanceof ObjectNode object ? object : null;
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Tool '" + toolName + "' has an invalid input schema", e);
		}
	}
}
