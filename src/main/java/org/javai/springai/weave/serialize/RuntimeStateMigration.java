package org.javai.springai.weave.serialize;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Upgrades a serialized state document by one schema version.
 *
 * <pre>{@code
 * public class V1ToV2Migration implements RuntimeStateMigration {
 *     public int fromVersion() { return 1; }
 *     public int toVersion() { return 2; }
 *     public void migrate(ObjectNode json) {
 *         if (json.has("log")) {
 *             json.set("aiInteractionLog", json.remove("log"));
 *         }
 *     }
 * }
 * }</pre>
 */
public interface RuntimeStateMigration {

	int fromVersion();

	/**
	 * Must be exactly {@code fromVersion() + 1}.
	 */
	int toVersion();

	/**
	 * Transforms the document in place.
	 */
	void migrate(ObjectNode json);

	default String description() {
		return "Migrate from v" + fromVersion() + " to v" + toVersion();
	}
}
