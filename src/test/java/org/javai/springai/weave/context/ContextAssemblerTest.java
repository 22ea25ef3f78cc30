package org.javai.springai.weave.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.springai.weave.ai.ModelConfig;
import org.javai.springai.weave.ast.ContextSpecifier;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.state.Frame;
import org.javai.springai.weave.state.FrameEntry;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ContextAssembler")
class ContextAssemblerTest {

	private RuntimeState state;

	@BeforeEach
	void setUp() {
		state = new RuntimeState("/main");
	}

	private void populateTwoFrames() {
		state.declareVariable("city", Value.text("Paris"), "text", false);
		state.appendEntry(new FrameEntry.PromptEntry(AiOperation.DO, "How many people live in Paris?", "2100000"));
		state.pushFrame(new Frame("helper", null));
		state.declareVariable("n", Value.number(3), "number", false);
		state.appendEntry(new FrameEntry.SummaryEntry("iterated over three files"));
	}

	@Nested
	@DisplayName("global context")
	class GlobalContext {

		@Test
		@DisplayName("should render every frame outermost first with nested indentation")
		void shouldRenderAllFrames() {
			// Given
			populateTwoFrames();

			// When
			String context = ContextAssembler.buildGlobalContext(state);

			// Then
			assertThat(context).isEqualTo(String.join("\n",
					"  main (entry)",
					"    - city (text): Paris",
					"    --> do: \"How many people live in Paris?\"",
					"    <-- 2100000",
					"    helper (current scope)",
					"      - n (number): 3",
					"      [summary] iterated over three files"));
		}

		@Test
		@DisplayName("should omit frames without visible entries")
		void shouldOmitEmptyFrames() {
			state.pushFrame(new Frame("helper", null));
			state.declareVariable("n", Value.number(1), null, false);

			assertThat(ContextAssembler.buildGlobalContext(state)).isEqualTo("    helper (current scope)\n      - n: 1");
		}

		@Test
		@DisplayName("should never render model or prompt variables")
		void shouldHideModelAndPromptVariables() {
			state.declareVariable("fast", ModelConfig.named("fast").toRef(), "model", true);
			state.declareVariable("style", Value.text("Be terse"), "prompt", true);
			state.declareVariable("topic", Value.text("bees"), null, false);

			String context = ContextAssembler.buildGlobalContext(state);

			assertThat(context).contains("- topic: bees");
			assertThat(context).doesNotContain("fast", "Be terse");
		}

		@Test
		@DisplayName("should show every assignment in execution order")
		void shouldShowAssignmentHistory() {
			state.declareVariable("count", Value.number(1), null, false);
			state.assign("count", Value.number(2));

			assertThat(ContextAssembler.buildGlobalContext(state))
					.isEqualTo("  main (current scope)\n    - count: 1\n    - count: 2");
		}
	}

	@Nested
	@DisplayName("context specifiers")
	class Specifiers {

		@Test
		@DisplayName("should render only the innermost frame for local context")
		void shouldRenderLocalContext() {
			populateTwoFrames();

			String context = ContextAssembler.build(state, ContextSpecifier.local());

			assertThat(context).startsWith("    helper (current scope)");
			assertThat(context).doesNotContain("Paris");
		}

		@Test
		@DisplayName("should render a named variable's value")
		void shouldRenderVariableContext() {
			populateTwoFrames();

			assertThat(ContextAssembler.build(state, ContextSpecifier.variable("city"))).isEqualTo("Paris");
		}

		@Test
		@DisplayName("should render loose entries without frame headers")
		void shouldRenderEntries() {
			String rendered = ContextAssembler.renderEntries(List.of(
					new FrameEntry.VariableEntry("item", Value.number(1), null, false),
					new FrameEntry.PromptEntry(AiOperation.ASK, "Continue?", null)));

			assertThat(rendered).isEqualTo("- item: 1\n--> ask: \"Continue?\"");
		}
	}
}
