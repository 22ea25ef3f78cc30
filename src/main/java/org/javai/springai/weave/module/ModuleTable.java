package org.javai.springai.weave.module;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loaded modules keyed by resolved path, in load order. Populated by the
 * {@link ModuleLoader} before execution and only read while stepping.
 */
public final class ModuleTable {

	private final Map<String, ModuleEntry> entries = new LinkedHashMap<>();

	public boolean contains(String path) {
		return entries.containsKey(path);
	}

	public ModuleEntry get(String path) {
		return entries.get(path);
	}

	void put(ModuleEntry entry) {
		entries.put(entry.path(), entry);
	}

	public Collection<ModuleEntry> entries() {
		return Collections.unmodifiableCollection(entries.values());
	}

	public List<String> paths() {
		return List.copyOf(entries.keySet());
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}
}
