package org.javai.springai.weave.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A host-side function the model (or program code) may call.
 *
 * <p>Implementations signal failure by throwing; the exception message is
 * handed back to the model as the tool's error result.</p>
 */
public interface Tool {

	ToolSchema schema();

	/**
	 * Runs the tool.
	 *
	 * @param arguments JSON object of named arguments
	 * @return the result, converted to a program value by the registry
	 */
	Object execute(JsonNode arguments, ToolExecutionContext context) throws Exception;

	default String name() {
		return schema().name();
	}

	/**
	 * Creates a tool from a schema and a lambda.
	 */
	static Tool of(ToolSchema schema, ToolFunction function) {
		return new Tool() {
			@Override
			public ToolSchema schema() {
				return schema;
			}

			@Override
			public Object execute(JsonNode arguments, ToolExecutionContext context) throws Exception {
				return function.execute(arguments, context);
			}
		};
	}

	@FunctionalInterface
	interface ToolFunction {
		Object execute(JsonNode arguments, ToolExecutionContext context) throws Exception;
	}
}
