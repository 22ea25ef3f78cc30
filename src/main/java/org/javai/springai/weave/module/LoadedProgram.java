package org.javai.springai.weave.module;

import java.util.Map;
import org.javai.springai.weave.state.ImportBinding;

/**
 * Result of loading an entry program's imports.
 *
 * @param moduleTable every module reachable from the entry program
 * @param bindings the entry program's imported names
 */
public record LoadedProgram(ModuleTable moduleTable, Map<String, ImportBinding> bindings) {

	public LoadedProgram {
		bindings = Map.copyOf(bindings);
	}
}
