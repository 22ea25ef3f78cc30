package org.javai.springai.weave.serialize;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry keyed by source version. A document is upgraded by resolving the
 * whole chain of single-step migrations first, so a gap is reported before any
 * step touches the document.
 */
public class DefaultRuntimeStateMigrationRegistry implements RuntimeStateMigrationRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefaultRuntimeStateMigrationRegistry.class);

	private final NavigableMap<Integer, RuntimeStateMigration> bySourceVersion = new TreeMap<>();
	private final int currentVersion;

	public DefaultRuntimeStateMigrationRegistry(int currentVersion) {
		if (currentVersion < 1) {
			throw new IllegalArgumentException("currentVersion must be >= 1");
		}
		this.currentVersion = currentVersion;
	}

	@Override
	public synchronized RuntimeStateMigrationRegistry register(RuntimeStateMigration migration) {
		if (migration == null) {
			throw new IllegalArgumentException("migration must not be null");
		}
		int from = migration.fromVersion();
		if (migration.toVersion() != from + 1) {
			throw new IllegalArgumentException("Migration must increment version by 1: " + from + " -> " + migration.toVersion());
		}
		if (bySourceVersion.containsKey(from)) {
			throw new IllegalArgumentException("Migration from version " + from + " already registered");
		}
		bySourceVersion.put(from, migration);
		logger.debug("Registered migration: {}", migration.description());
		return this;
	}

	@Override
	public void migrateToCurrentVersion(ObjectNode json, int fromVersion) {
		if (fromVersion > currentVersion) {
			throw new RuntimeStateSerializer.DeserializationVersionException(fromVersion,
					"Blob version " + fromVersion + " is newer than current version " + currentVersion);
		}
		List<RuntimeStateMigration> chain = chainFrom(fromVersion).orElseThrow(() -> missingStep(fromVersion));
		if (chain.isEmpty()) {
			return;
		}
		logger.debug("Upgrading state document v{} -> v{} in {} step(s)", fromVersion, currentVersion, chain.size());
		for (RuntimeStateMigration step : chain) {
			try {
				step.migrate(json);
			}
			catch (RuntimeException e) {
				throw new RuntimeStateSerializer.DeserializationVersionException(fromVersion,
						"Migration failed: " + step.description(), e);
			}
			logger.debug("Applied: {}", step.description());
		}
	}

	@Override
	public int currentVersion() {
		return currentVersion;
	}

	@Override
	public boolean canMigrate(int fromVersion) {
		return fromVersion >= 1 && fromVersion <= currentVersion && chainFrom(fromVersion).isPresent();
	}

	public synchronized int migrationCount() {
		return bySourceVersion.size();
	}

	/**
	 * The migrations leading from {@code fromVersion} to the current version,
	 * empty when the version is already current, absent when a step is missing.
	 */
	private synchronized Optional<List<RuntimeStateMigration>> chainFrom(int fromVersion) {
		List<RuntimeStateMigration> chain = new ArrayList<>();
		for (int version = fromVersion; version < currentVersion; version++) {
			RuntimeStateMigration step = bySourceVersion.get(version);
			if (step == null) {
				return Optional.empty();
			}
			chain.add(step);
		}
		return Optional.of(chain);
	}

	private synchronized RuntimeStateSerializer.DeserializationVersionException missingStep(int fromVersion) {
		int gap = fromVersion;
		while (gap < currentVersion && bySourceVersion.containsKey(gap)) {
			gap++;
		}
		return new RuntimeStateSerializer.DeserializationVersionException(fromVersion,
				"No migration registered for version " + gap + " -> " + (gap + 1));
	}
}
