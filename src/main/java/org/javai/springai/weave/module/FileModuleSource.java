package org.javai.springai.weave.module;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.springai.weave.ast.Program;

/**
 * Reads modules from the file system. Specifiers resolve against the
 * importing module's directory.
 */
public class FileModuleSource implements ModuleSource {

	private final ProgramParser parser;

	public FileModuleSource(ProgramParser parser) {
		this.parser = parser;
	}

	@Override
	public String resolve(String importerPath, String specifier) {
		Path base = importerPath != null ? Path.of(importerPath).toAbsolutePath().getParent() : Path.of("").toAbsolutePath();
		return base.resolve(specifier).normalize().toString();
	}

	@Override
	public Program load(String path) {
		try {
			return parser.parse(Files.readString(Path.of(path), StandardCharsets.UTF_8), path);
		}
		catch (IOException e) {
			throw new ModuleLoadException(path, "Failed to read module '" + path + "'", e);
		}
	}
}
