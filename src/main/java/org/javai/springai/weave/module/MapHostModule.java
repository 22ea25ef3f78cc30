package org.javai.springai.weave.module;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.javai.springai.weave.value.Value;

/**
 * A host module backed by a map of Java functions.
 *
 * <pre>{@code
 * HostModule math = MapHostModule.builder("/host/math")
 *         .export("double", args -> Value.number(((Value.Num) args.get(0)).value() * 2))
 *         .build();
 * }</pre>
 */
public final class MapHostModule implements HostModule {

	private final String path;
	private final Map<String, Function<List<Value>, Value>> exports;

	private MapHostModule(String path, Map<String, Function<List<Value>, Value>> exports) {
		this.path = path;
		this.exports = Map.copyOf(exports);
	}

	public static Builder builder(String path) {
		return new Builder(path);
	}

	@Override
	public Set<String> exportNames() {
		return exports.keySet();
	}

	@Override
	public Value invoke(String exportName, List<Value> args) {
		Function<List<Value>, Value> function = exports.get(exportName);
		if (function == null) {
			throw new ExportNotFoundException(path, exportName);
		}
		Value result = function.apply(List.copyOf(args));
		return result != null ? result : Value.NULL;
	}

	public static final class Builder {
		private final String path;
		private final Map<String, Function<List<Value>, Value>> exports = new LinkedHashMap<>();

		private Builder(String path) {
			this.path = path;
		}

		public Builder export(String name, Function<List<Value>, Value> function) {
			exports.put(name, function);
			return this;
		}

		public MapHostModule build() {
			return new MapHostModule(path, exports);
		}
	}
}
