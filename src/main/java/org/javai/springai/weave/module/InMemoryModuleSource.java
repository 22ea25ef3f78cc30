package org.javai.springai.weave.module;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.springai.weave.ast.Program;

/**
 * Modules held in memory under absolute, slash-separated paths. Relative
 * specifiers ({@code ./x}, {@code ../x}) resolve against the importer's
 * directory.
 */
public class InMemoryModuleSource implements ModuleSource {

	private final Map<String, Program> programs = new LinkedHashMap<>();

	public InMemoryModuleSource add(String path, Program program) {
		programs.put(normalize(path), program);
		return this;
	}

	@Override
	public String resolve(String importerPath, String specifier) {
		if (specifier.startsWith("/")) {
			return normalize(specifier);
		}
		String base = importerPath != null ? importerPath : "/";
		return normalize(URI.create(base).resolve(specifier).getPath());
	}

	@Override
	public Program load(String path) {
		Program program = programs.get(path);
		if (program == null) {
			throw new ModuleLoadException(path, "Module '" + path + "' not found");
		}
		return program;
	}

	private static String normalize(String path) {
		return URI.create(path).normalize().getPath();
	}
}
