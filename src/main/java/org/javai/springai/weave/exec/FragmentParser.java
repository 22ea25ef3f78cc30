package org.javai.springai.weave.exec;

import org.javai.springai.weave.GeneratedCodeSyntaxException;
import org.javai.springai.weave.ast.Statement;

/**
 * Parses code generated for a {@code vibe} request into a function
 * declaration. Implementations wrap the language front end.
 */
@FunctionalInterface
public interface FragmentParser {

	/**
	 * @throws GeneratedCodeSyntaxException if {@code source} is not a single function declaration
	 */
	Statement.FunctionDecl parseFunction(String source);
}
