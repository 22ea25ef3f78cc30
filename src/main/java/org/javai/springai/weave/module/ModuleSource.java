package org.javai.springai.weave.module;

import org.javai.springai.weave.ast.Program;

/**
 * Where the {@link ModuleLoader} finds language modules.
 */
public interface ModuleSource {

	/**
	 * Resolves an import specifier relative to the importing module.
	 *
	 * @param importerPath resolved path of the importing module
	 * @param specifier the source string of the import statement
	 * @return the resolved absolute path used as the module's cache key
	 */
	String resolve(String importerPath, String specifier);

	/**
	 * Loads the program stored at a resolved path.
	 *
	 * @throws ModuleLoadException if the module cannot be read or parsed
	 */
	Program load(String path);
}
