package org.javai.springai.weave.tool;

import java.nio.file.Path;
import java.util.Map;

/**
 * Ambient information handed to every tool execution.
 *
 * @param workingDirectory directory relative paths are resolved against
 * @param attributes free-form values supplied by the host application
 */
public record ToolExecutionContext(Path workingDirectory, Map<String, Object> attributes) {

	public ToolExecutionContext {
		attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
	}

	public static ToolExecutionContext of(Path workingDirectory) {
		return new ToolExecutionContext(workingDirectory, Map.of());
	}

	public static ToolExecutionContext empty() {
		return new ToolExecutionContext(null, Map.of());
	}
}
