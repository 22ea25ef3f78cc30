package org.javai.springai.weave.module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.javai.springai.weave.state.FunctionEntry;
import org.javai.springai.weave.state.ImportBinding;
import org.javai.springai.weave.value.Value;

/**
 * A loaded module, cached in the {@link ModuleTable} by resolved path.
 *
 * <p>Language modules carry their function table, the values of their
 * top-level declarations, their export set and their own imports. Host
 * modules carry a supplier that evaluates the module once, on first
 * access.</p>
 */
public final class ModuleEntry {

	private final String path;
	private final ModuleKind kind;
	private final Map<String, FunctionEntry> functions;
	private final Map<String, Value> values;
	private final Set<String> exports;
	private final Map<String, ImportBinding> imports;
	private final Supplier<HostModule> hostModule;

	private ModuleEntry(String path, ModuleKind kind, Map<String, FunctionEntry> functions, Map<String, Value> values,
			Set<String> exports, Map<String, ImportBinding> imports, Supplier<HostModule> hostModule) {
		this.path = Objects.requireNonNull(path, "path must not be null");
		this.kind = kind;
		this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
		this.exports = Collections.unmodifiableSet(new LinkedHashSet<>(exports));
		this.imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
		this.hostModule = hostModule;
	}

	public static ModuleEntry language(String path, Map<String, FunctionEntry> functions, Map<String, Value> values,
			Set<String> exports, Map<String, ImportBinding> imports) {
		return new ModuleEntry(path, ModuleKind.LANGUAGE, functions, values, exports, imports, null);
	}

	public static ModuleEntry host(String path, Supplier<HostModule> hostModule) {
		return new ModuleEntry(path, ModuleKind.HOST, Map.of(), Map.of(), Set.of(), Map.of(),
				Objects.requireNonNull(hostModule, "hostModule must not be null"));
	}

	public String path() {
		return path;
	}

	public ModuleKind kind() {
		return kind;
	}

	public Map<String, FunctionEntry> functions() {
		return functions;
	}

	public Map<String, Value> values() {
		return values;
	}

	public Map<String, ImportBinding> imports() {
		return imports;
	}

	/**
	 * The names this module exports. For a host module this evaluates the
	 * module if it has not been evaluated yet.
	 */
	public Set<String> exports() {
		return kind == ModuleKind.HOST ? hostModule().exportNames() : exports;
	}

	public boolean hasExport(String name) {
		return exports().contains(name);
	}

	public HostModule hostModule() {
		if (kind != ModuleKind.HOST) {
			throw new IllegalStateException("Module '" + path + "' is not a host module");
		}
		return hostModule.get();
	}

	@Override
	public String toString() {
		return "ModuleEntry[" + kind + " " + path + "]";
	}
}
