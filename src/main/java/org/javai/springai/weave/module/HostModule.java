package org.javai.springai.weave.module;

import java.util.List;
import java.util.Set;
import org.javai.springai.weave.value.Value;

/**
 * A module implemented in the host language. Calls to its exports suspend
 * the engine; a driver performs them through {@link #invoke}.
 */
public interface HostModule {

	Set<String> exportNames();

	/**
	 * Invokes an exported function.
	 *
	 * @throws ExportNotFoundException if {@code exportName} is not exported
	 */
	Value invoke(String exportName, List<Value> args);
}
