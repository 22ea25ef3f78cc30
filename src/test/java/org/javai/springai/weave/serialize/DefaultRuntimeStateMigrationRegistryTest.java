package org.javai.springai.weave.serialize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.function.Consumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultRuntimeStateMigrationRegistry")
class DefaultRuntimeStateMigrationRegistryTest {

	private static RuntimeStateMigration migration(int from, int to, Consumer<ObjectNode> body) {
		return new RuntimeStateMigration() {
			@Override
			public int fromVersion() {
				return from;
			}

			@Override
			public int toVersion() {
				return to;
			}

			@Override
			public void migrate(ObjectNode json) {
				body.accept(json);
			}
		};
	}

	@Test
	@DisplayName("should apply migrations in version order")
	void shouldChainMigrations() {
		// Given
		DefaultRuntimeStateMigrationRegistry registry = new DefaultRuntimeStateMigrationRegistry(3);
		registry.register(migration(2, 3, json -> json.put("steps", json.get("steps").asText() + ",2->3")));
		registry.register(migration(1, 2, json -> json.put("steps", "1->2")));
		ObjectNode json = JsonNodeFactory.instance.objectNode();

		// When
		registry.migrateToCurrentVersion(json, 1);

		// Then
		assertThat(json.get("steps").asText()).isEqualTo("1->2,2->3");
		assertThat(registry.migrationCount()).isEqualTo(2);
	}

	@Test
	@DisplayName("should leave a current document untouched")
	void shouldSkipCurrentVersion() {
		DefaultRuntimeStateMigrationRegistry registry = new DefaultRuntimeStateMigrationRegistry(2);
		registry.register(migration(1, 2, json -> json.put("touched", true)));
		ObjectNode json = JsonNodeFactory.instance.objectNode();

		registry.migrateToCurrentVersion(json, 2);

		assertThat(json.isEmpty()).isTrue();
	}

	@Test
	@DisplayName("should report whether a migration path exists")
	void shouldReportMigrationPaths() {
		DefaultRuntimeStateMigrationRegistry registry = new DefaultRuntimeStateMigrationRegistry(3);
		registry.register(migration(2, 3, json -> {
		}));

		assertThat(registry.canMigrate(3)).isTrue();
		assertThat(registry.canMigrate(2)).isTrue();
		assertThat(registry.canMigrate(1)).isFalse();
		assertThat(registry.canMigrate(4)).isFalse();
		assertThat(registry.canMigrate(0)).isFalse();
	}

	@Test
	@DisplayName("should reject migrations that skip versions or repeat a source version")
	void shouldRejectInvalidRegistrations() {
		DefaultRuntimeStateMigrationRegistry registry = new DefaultRuntimeStateMigrationRegistry(3);
		registry.register(migration(1, 2, json -> {
		}));

		assertThatThrownBy(() -> registry.register(migration(1, 3, json -> {
		}))).isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Migration must increment version by 1: 1 -> 3");
		assertThatThrownBy(() -> registry.register(migration(1, 2, json -> {
		}))).isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Migration from version 1 already registered");
		assertThatThrownBy(() -> new DefaultRuntimeStateMigrationRegistry(0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("should wrap a failing migration as a version error")
	void shouldWrapFailures() {
		DefaultRuntimeStateMigrationRegistry registry = new DefaultRuntimeStateMigrationRegistry(2);
		registry.register(migration(1, 2, json -> {
			throw new IllegalStateException("bad document");
		}));

		assertThatThrownBy(() -> registry.migrateToCurrentVersion(JsonNodeFactory.instance.objectNode(), 1))
				.isInstanceOf(RuntimeStateSerializer.DeserializationVersionException.class)
				.hasMessage("Migration failed: Migrate from v1 to v2")
				.hasCauseInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("should refuse documents newer than the current version")
	void shouldRejectNewerDocuments() {
		DefaultRuntimeStateMigrationRegistry registry = new DefaultRuntimeStateMigrationRegistry(1);

		assertThatThrownBy(() -> registry.migrateToCurrentVersion(JsonNodeFactory.instance.objectNode(), 2))
				.isInstanceOf(RuntimeStateSerializer.DeserializationVersionException.class)
				.hasMessage("Blob version 2 is newer than current version 1");
	}
}
