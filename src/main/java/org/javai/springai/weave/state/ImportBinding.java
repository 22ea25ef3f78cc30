package org.javai.springai.weave.state;

import java.util.Objects;
import org.javai.springai.weave.module.ModuleKind;

/**
 * A name bound by an import statement.
 *
 * @param localName the name visible in the importing program
 * @param modulePath resolved absolute path of the module
 * @param exportName the export the name refers to
 * @param kind the module's kind
 */
public record ImportBinding(String localName, String modulePath, String exportName, ModuleKind kind) {

	public ImportBinding {
		Objects.requireNonNull(localName, "localName must not be null");
		Objects.requireNonNull(modulePath, "modulePath must not be null");
		Objects.requireNonNull(exportName, "exportName must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
	}

	/**
	 * Whether two bindings denote the same export, so re-importing is a no-op.
	 */
	public boolean sameTargetAs(ImportBinding other) {
		return modulePath.equals(other.modulePath) && exportName.equals(other.exportName);
	}
}
