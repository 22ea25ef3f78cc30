package org.javai.springai.weave.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.javai.springai.weave.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

/**
 * The tools available to one engine instance.
 *
 * <p>The registry is built once and read-only afterwards. Execution never
 * throws: an unknown tool or a failing tool becomes a failed
 * {@link ToolResult} carrying the error text.</p>
 *
 * <pre>{@code
 * ToolRegistry tools = ToolRegistry.builder()
 *         .tool(readFileTool)
 *         .toolObjects(new CatalogTools())   // @Tool-annotated methods
 *         .build();
 * }</pre>
 */
public final class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	private static final ToolRegistry EMPTY = new ToolRegistry(Map.of());

	private final Map<String, Tool> tools;

	private ToolRegistry(Map<String, Tool> tools) {
		this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
	}

	public static ToolRegistry empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean contains(String name) {
		return tools.containsKey(name);
	}

	public Optional<Tool> find(String name) {
		return Optional.ofNullable(tools.get(name));
	}

	public Collection<Tool> tools() {
		return tools.values();
	}

	/**
	 * Schemas of the named tools. Names that are not registered are skipped.
	 */
	public List<ToolSchema> schemas(List<String> names) {
		List<ToolSchema> schemas = new ArrayList<>();
		for (String name : names) {
			Tool tool = tools.get(name);
			if (tool != null) {
				schemas.add(tool.schema());
			}
			else {
				logger.warn("Model references unknown tool '{}'", name);
			}
		}
		return schemas;
	}

	/**
	 * Executes one call, capturing every failure as an error result.
	 */
	public ToolResult execute(ToolCall call, ToolExecutionContext context) {
		Tool tool = tools.get(call.toolName());
		if (tool == null) {
			logger.warn("Tool call {} requested unknown tool '{}'", call.id(), call.toolName());
			return ToolResult.failure(call.id(), "Tool '" + call.toolName() + "' not found");
		}
		try {
			Object result = tool.execute(call.arguments(), context);
			return ToolResult.success(call.id(), Values.fromJava(result));
		}
		catch (Exception e) {
			String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			logger.warn("Tool '{}' failed for call {}: {}", call.toolName(), call.id(), message);
			return ToolResult.failure(call.id(), message);
		}
	}

	/**
	 * Executes every call of a round and returns the results in call order.
	 * Results are paired to calls by id, so when an executor is supplied the
	 * calls may run concurrently; with {@code null} they run one after another.
	 */
	public List<ToolResult> executeAll(List<ToolCall> calls, ToolExecutionContext context, Executor executor) {
		Map<String, ToolResult> byId = new HashMap<>();
		if (executor == null) {
			for (ToolCall call : calls) {
				byId.put(call.id(), execute(call, context));
			}
		}
		else {
			Map<String, CompletableFuture<ToolResult>> futures = new LinkedHashMap<>();
			for (ToolCall call : calls) {
				futures.put(call.id(), CompletableFuture.supplyAsync(() -> execute(call, context), executor));
			}
			futures.forEach((id, future) -> byId.put(id, future.join()));
		}
		List<ToolResult> results = new ArrayList<>(calls.size());
		for (ToolCall call : calls) {
			results.add(byId.get(call.id()));
		}
		return results;
	}

	public static final class Builder {
		private final Map<String, Tool> tools = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder tool(Tool tool) {
			if (tools.putIfAbsent(tool.name(), tool) != null) {
				throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
			}
			return this;
		}

		public Builder tools(Collection<? extends Tool> toolList) {
			toolList.forEach(this::tool);
			return this;
		}

		public Builder toolCallbacks(ToolCallback... callbacks) {
			for (ToolCallback callback : callbacks) {
				tool(new ToolCallbackTool(callback));
			}
			return this;
		}

		/**
		 * Registers every {@code @Tool}-annotated method of the given beans.
		 */
		public Builder toolObjects(Object... beans) {
			ToolCallback[] callbacks = MethodToolCallbackProvider.builder()
					.toolObjects(beans)
					.build()
					.getToolCallbacks();
			return toolCallbacks(callbacks);
		}

		public ToolRegistry build() {
			return new ToolRegistry(tools);
		}
	}
}
