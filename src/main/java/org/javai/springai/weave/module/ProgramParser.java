package org.javai.springai.weave.module;

import org.javai.springai.weave.ast.Program;

/**
 * Turns module source text into a program. The surface-syntax parser lives
 * outside the engine; {@link JsonProgramParser} reads the AST's JSON form.
 */
@FunctionalInterface
public interface ProgramParser {

	Program parse(String source, String path);
}
