package org.javai.springai.weave.serialize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.springai.weave.ast.Ast.assign;
import static org.javai.springai.weave.ast.Ast.binary;
import static org.javai.springai.weave.ast.Ast.call;
import static org.javai.springai.weave.ast.Ast.constant;
import static org.javai.springai.weave.ast.Ast.doAi;
import static org.javai.springai.weave.ast.Ast.export;
import static org.javai.springai.weave.ast.Ast.expr;
import static org.javai.springai.weave.ast.Ast.forIn;
import static org.javai.springai.weave.ast.Ast.function;
import static org.javai.springai.weave.ast.Ast.id;
import static org.javai.springai.weave.ast.Ast.importFrom;
import static org.javai.springai.weave.ast.Ast.let;
import static org.javai.springai.weave.ast.Ast.num;
import static org.javai.springai.weave.ast.Ast.program;
import static org.javai.springai.weave.ast.Ast.ret;

import java.util.List;
import org.javai.springai.weave.WeaveEngine;
import org.javai.springai.weave.ast.Ast;
import org.javai.springai.weave.ast.BinaryOperator;
import org.javai.springai.weave.ast.Program;
import org.javai.springai.weave.module.InMemoryModuleSource;
import org.javai.springai.weave.module.ModuleLoader;
import org.javai.springai.weave.state.PendingRequest;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.state.RuntimeStatus;
import org.javai.springai.weave.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JsonRuntimeStateSerializer")
class JsonRuntimeStateSerializerTest {

	private WeaveEngine engine;
	private JsonRuntimeStateSerializer serializer;

	@BeforeEach
	void setUp() {
		engine = WeaveEngine.builder().build();
		serializer = new JsonRuntimeStateSerializer();
	}

	/**
	 * function twice(x) { return x * 2 }
	 * let total = 0
	 * for i in [1, 2] { total = total + twice(i) }
	 * let y: number = do "2+2"
	 * total + y
	 */
	private static Program suspendingProgram() {
		return program(
				function("twice", List.of("x"), ret(binary(BinaryOperator.MULTIPLY, id("x"), num(2)))),
				let("total", num(0)),
				forIn("i", Ast.array(num(1), num(2)),
						expr(assign("total", binary(BinaryOperator.ADD, id("total"), call("twice", id("i")))))),
				let("y", "number", doAi("2+2", "default")),
				expr(binary(BinaryOperator.ADD, id("total"), id("y"))));
	}

	private RuntimeState roundTrip(RuntimeState state) {
		return serializer.deserialize(serializer.serialize(state));
	}

	@Nested
	@DisplayName("round trip")
	class RoundTrip {

		@Test
		@DisplayName("should resume a deserialized suspended state to the same result")
		void shouldResumeRestoredState() {
			// Given
			RuntimeState suspended = engine.runUntilPause(engine.newState(suspendingProgram()));
			assertThat(suspended.status()).isEqualTo(RuntimeStatus.AWAITING_AI);

			// When
			RuntimeState restored = roundTrip(suspended);
			engine.runUntilPause(engine.resumeWithAIResponse(restored, "4"));

			// Then
			assertThat(restored.status()).isEqualTo(RuntimeStatus.COMPLETED);
			assertThat(restored.lastResult()).isEqualTo(Value.number(10));
			assertThat(engine.getValue(restored, "y")).isEqualTo(Value.number(4));
			assertThat(restored.aiInteractionLog()).singleElement()
					.satisfies(interaction -> assertThat(interaction.response()).isEqualTo("4"));
		}

		@Test
		@DisplayName("should step in lockstep with the original after both are resumed")
		void shouldStepIdenticallyAfterResume() {
			// Given
			RuntimeState original = engine.runUntilPause(engine.newState(suspendingProgram()));
			RuntimeState restored = roundTrip(original);

			// When
			engine.resumeWithAIResponse(original, "4");
			engine.resumeWithAIResponse(restored, "4");

			// Then
			while (original.status() == RuntimeStatus.RUNNING) {
				assertThat(serializer.toReadableJson(serializer.serialize(restored)))
						.isEqualTo(serializer.toReadableJson(serializer.serialize(original)));
				engine.step(original);
				engine.step(restored);
			}
			assertThat(restored.status()).isEqualTo(original.status());
			assertThat(restored.lastResult()).isEqualTo(original.lastResult());
		}

		@Test
		@DisplayName("should preserve the pending request")
		void shouldPreservePendingRequest() {
			RuntimeState suspended = engine.runUntilPause(engine.newState(suspendingProgram()));

			RuntimeState restored = roundTrip(suspended);

			assertThat(restored.pendingRequest()).isEqualTo(suspended.pendingRequest());
			assertThat(restored.pendingRequest()).isInstanceOf(PendingRequest.PendingAi.class);
		}

		@Test
		@DisplayName("should survive a serialize/deserialize cycle after every step")
		void shouldMatchStepByStep() {
			// Given
			Program program = program(
					function("twice", List.of("x"), ret(binary(BinaryOperator.MULTIPLY, id("x"), num(2)))),
					let("total", num(0)),
					forIn("i", Ast.array(num(1), num(2), num(3)),
							expr(assign("total", binary(BinaryOperator.ADD, id("total"), call("twice", id("i")))))),
					expr(id("total")));
			RuntimeState direct = engine.runUntilPause(engine.newState(program));

			// When
			RuntimeState state = engine.newState(program);
			int steps = 0;
			while (state.status() == RuntimeStatus.RUNNING) {
				byte[] blob = serializer.serialize(state);
				state = serializer.deserialize(blob);
				assertThat(serializer.toReadableJson(serializer.serialize(state)))
						.isEqualTo(serializer.toReadableJson(blob));
				state = engine.step(state);
				steps++;
			}

			// Then
			assertThat(steps).isGreaterThan(10);
			assertThat(state.status()).isEqualTo(RuntimeStatus.COMPLETED);
			assertThat(state.lastResult()).isEqualTo(direct.lastResult()).isEqualTo(Value.number(12));
		}

		@Test
		@DisplayName("should render the blob as readable json")
		void shouldRenderReadableJson() {
			RuntimeState suspended = engine.runUntilPause(engine.newState(suspendingProgram()));

			String json = serializer.toReadableJson(serializer.serialize(suspended));

			assertThat(json).contains("\"status\" : \"AWAITING_AI\"", "\"entryPath\" : \"/main\"", "\"callStack\"");
			assertThat(serializer.toReadableJson(new byte[3])).isEqualTo("{}");
		}
	}

	@Nested
	@DisplayName("integrity")
	class Integrity {

		@Test
		@DisplayName("should reject a tampered blob")
		void shouldRejectTamperedBlob() {
			byte[] blob = serializer.serialize(engine.runUntilPause(engine.newState(suspendingProgram())));
			blob[blob.length - 1] ^= 0x01;

			assertThatThrownBy(() -> serializer.deserialize(blob))
					.isInstanceOf(RuntimeStateSerializer.IntegrityException.class)
					.hasMessage("Blob integrity check failed - data may have been tampered with");
		}

		@Test
		@DisplayName("should reject short blobs and foreign data")
		void shouldRejectMalformedBlobs() {
			byte[] blob = serializer.serialize(new RuntimeState("/main"));
			blob[0] = 'X';

			assertThatThrownBy(() -> serializer.deserialize(new byte[10]))
					.isInstanceOf(RuntimeStateSerializer.IntegrityException.class)
					.hasMessage("Blob is too short or null");
			assertThatThrownBy(() -> serializer.deserialize(blob))
					.isInstanceOf(RuntimeStateSerializer.IntegrityException.class)
					.hasMessage("Invalid blob magic number");
		}

		@Test
		@DisplayName("should refuse to encode values with no durable form")
		void shouldRejectOpaqueValues() {
			RuntimeState state = new RuntimeState("/main");
			state.declareVariable("handle", new Value.Opaque(new Object()), null, false);

			assertThatThrownBy(() -> serializer.serialize(state))
					.isInstanceOf(RuntimeStateSerializer.UnsupportedValueException.class)
					.satisfies(e -> assertThat(((RuntimeStateSerializer.UnsupportedValueException) e).errorType())
							.isEqualTo("UnsupportedValue"));
		}
	}

	@Nested
	@DisplayName("versions")
	class Versions {

		@Test
		@DisplayName("should fail closed on a blob from a newer version")
		void shouldRejectNewerVersion() {
			byte[] blob = serializer.serialize(new RuntimeState("/main"));
			blob[5] = 2;

			assertThatThrownBy(() -> serializer.deserialize(blob))
					.isInstanceOf(RuntimeStateSerializer.DeserializationVersionException.class)
					.satisfies(e -> assertThat(((RuntimeStateSerializer.DeserializationVersionException) e).blobVersion())
							.isEqualTo(2));
		}

		@Test
		@DisplayName("should migrate an older blob to the current version")
		void shouldMigrateOlderBlob() {
			// Given: a version 1 blob and a reader at version 2
			byte[] v1 = serializer.serialize(new RuntimeState("/main"));
			RuntimeStateMigration bumpCounter = new RuntimeStateMigration() {
				@Override
				public int fromVersion() {
					return 1;
				}

				@Override
				public int toVersion() {
					return 2;
				}

				@Override
				public void migrate(com.fasterxml.jackson.databind.node.ObjectNode json) {
					json.put("callCounter", 41);
				}
			};
			JsonRuntimeStateSerializer v2 = new JsonRuntimeStateSerializer(
					new DefaultRuntimeStateMigrationRegistry(2).register(bumpCounter), null);

			// When
			RuntimeState restored = v2.deserialize(v1);

			// Then
			assertThat(v2.schemaVersion()).isEqualTo(2);
			assertThat(restored.callCounter()).isEqualTo(41);
			assertThat(restored.nextCallId()).isEqualTo("call-42");
		}

		@Test
		@DisplayName("should fail closed when no migration path exists")
		void shouldRejectMissingMigration() {
			byte[] v1 = serializer.serialize(new RuntimeState("/main"));
			JsonRuntimeStateSerializer v2 = new JsonRuntimeStateSerializer(new DefaultRuntimeStateMigrationRegistry(2), null);

			assertThatThrownBy(() -> v2.deserialize(v1))
					.isInstanceOf(RuntimeStateSerializer.DeserializationVersionException.class)
					.hasMessage("No migration registered for version 1 -> 2");
		}
	}

	@Nested
	@DisplayName("modules")
	class Modules {

		private InMemoryModuleSource source;

		@BeforeEach
		void setUp() {
			source = new InMemoryModuleSource()
					.add("/lib/math", program(export(constant("factor", num(10)))));
		}

		@Test
		@DisplayName("should record module paths and reload them on read")
		void shouldReloadModules() {
			// Given
			ModuleLoader loader = new ModuleLoader(source);
			WeaveEngine moduleEngine = WeaveEngine.builder().moduleLoader(loader).build();
			RuntimeState state = moduleEngine.load(program(importFrom("./lib/math", "factor"),
					let("y", doAi("scale", "default")),
					expr(binary(BinaryOperator.MULTIPLY, id("factor"), num(2)))), "/main");
			moduleEngine.runUntilPause(state);
			JsonRuntimeStateSerializer withLoader = new JsonRuntimeStateSerializer(null, new ModuleLoader(source));

			// When
			byte[] blob = withLoader.serialize(state);
			RuntimeState restored = withLoader.deserialize(blob);
			moduleEngine.runUntilPause(moduleEngine.resumeWithAIResponse(restored, "ok"));

			// Then
			assertThat(serializer.toReadableJson(blob)).doesNotContain("factor\" : 10");
			assertThat(restored.moduleTable().paths()).containsExactly("/lib/math");
			assertThat(restored.lastResult()).isEqualTo(Value.number(20));
		}

		@Test
		@DisplayName("should require a module loader for states that reference modules")
		void shouldRequireLoader() {
			WeaveEngine moduleEngine = WeaveEngine.builder().moduleLoader(new ModuleLoader(source)).build();
			RuntimeState state = moduleEngine.load(program(importFrom("./lib/math", "factor")), "/main");

			byte[] blob = serializer.serialize(state);

			assertThatThrownBy(() -> serializer.deserialize(blob))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("State references modules but no module loader is configured");
		}
	}
}
