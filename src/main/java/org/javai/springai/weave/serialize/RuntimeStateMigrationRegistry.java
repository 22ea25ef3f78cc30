package org.javai.springai.weave.serialize;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Chains {@link RuntimeStateMigration}s to bring old documents to the current version.
 */
public interface RuntimeStateMigrationRegistry {

	/**
	 * @throws IllegalArgumentException if a migration from the same version is already registered
	 */
	RuntimeStateMigrationRegistry register(RuntimeStateMigration migration);

	/**
	 * Applies every migration from {@code fromVersion} up to {@link #currentVersion()}, in order.
	 *
	 * @throws RuntimeStateSerializer.DeserializationVersionException if a step is missing or fails,
	 * or if {@code fromVersion} is newer than the current version
	 */
	void migrateToCurrentVersion(ObjectNode json, int fromVersion);

	int currentVersion();

	boolean canMigrate(int fromVersion);
}
