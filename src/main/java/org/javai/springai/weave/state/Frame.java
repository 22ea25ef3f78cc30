package org.javai.springai.weave.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One level of the call stack: the bindings of a function call (or of the
 * entry program) with nested blocks flattened into it, plus its ordered
 * entry history.
 */
public class Frame {

	private final String name;
	private final String modulePath;
	private final LinkedHashMap<String, Variable> locals;
	private final List<FrameEntry> orderedEntries;

	public Frame(String name, String modulePath) {
		this(name, modulePath, new LinkedHashMap<>(), new ArrayList<>());
	}

	public Frame(String name, String modulePath, Map<String, Variable> locals, List<FrameEntry> orderedEntries) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.modulePath = modulePath;
		this.locals = new LinkedHashMap<>(locals);
		this.orderedEntries = new ArrayList<>(orderedEntries);
	}

	public String name() {
		return name;
	}

	/**
	 * Resolved path of the module whose function owns this frame, or
	 * {@code null} for the entry program.
	 */
	public String modulePath() {
		return modulePath;
	}

	public Map<String, Variable> locals() {
		return Collections.unmodifiableMap(locals);
	}

	public List<FrameEntry> orderedEntries() {
		return Collections.unmodifiableList(orderedEntries);
	}

	public Variable get(String variableName) {
		return locals.get(variableName);
	}

	public boolean has(String variableName) {
		return locals.containsKey(variableName);
	}

	void put(String variableName, Variable variable) {
		locals.put(variableName, variable);
	}

	void append(FrameEntry entry) {
		orderedEntries.add(entry);
	}

	/**
	 * Drops every binding whose name is not in {@code keep}.
	 */
	void retainLocals(Set<String> keep) {
		locals.keySet().retainAll(keep);
	}

	/**
	 * Drops entries from {@code start} on, optionally replacing them with one
	 * entry.
	 */
	void replaceEntriesFrom(int start, FrameEntry replacement) {
		if (start < orderedEntries.size()) {
			orderedEntries.subList(start, orderedEntries.size()).clear();
		}
		if (replacement != null) {
			orderedEntries.add(replacement);
		}
	}

	Frame copy() {
		return new Frame(name, modulePath, locals, orderedEntries);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Frame other)) {
			return false;
		}
		return name.equals(other.name) && Objects.equals(modulePath, other.modulePath)
				&& locals.equals(other.locals) && orderedEntries.equals(other.orderedEntries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, modulePath, locals, orderedEntries);
	}

	@Override
	public String toString() {
		return "Frame[" + name + ", locals=" + locals.keySet() + ", entries=" + orderedEntries.size() + "]";
	}
}
