package org.javai.springai.weave.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.logging.log4j.Level;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.testsupport.LogCaptor;
import org.javai.springai.weave.tool.Tool;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolExecutionContext;
import org.javai.springai.weave.tool.ToolRegistry;
import org.javai.springai.weave.tool.ToolResult;
import org.javai.springai.weave.tool.ToolSchema;
import org.javai.springai.weave.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ToolCallingLoop")
class ToolCallingLoopTest {

	private ToolRegistry tools;
	private AiRequest request;
	private final List<AiRequest> sent = new ArrayList<>();

	@BeforeEach
	void setUp() {
		Tool lookup = Tool.of(ToolSchema.builder("lookup").parameter("key", "string", "key to look up", true).build(),
				(arguments, context) -> "value of " + arguments.get("key").asText());
		tools = ToolRegistry.builder().tool(lookup).build();
		request = new AiRequest(AiOperation.DO, "What is a?", "", null, ModelConfig.named("default"),
				List.of(lookup.schema()), List.of());
	}

	private static ToolCall lookupCall(String id, String key) {
		return new ToolCall(id, "lookup", JsonNodeFactory.instance.objectNode().put("key", key));
	}

	private static AiResponse withUsage(AiResponse response, int in, int out) {
		return new AiResponse(response.content(), null, new TokenUsage(in, out), response.toolCalls(), null);
	}

	@Test
	@DisplayName("should execute requested tools and send their results back")
	void shouldRunToolRound() {
		// Given: the model calls one tool, then answers
		List<AiResponse> script = new ArrayList<>(List.of(
				withUsage(AiResponse.toolUse(List.of(lookupCall("c1", "a"))), 10, 3),
				withUsage(AiResponse.text("a is value of a"), 20, 5)));

		// When
		ToolLoopResult result = new ToolCallingLoop(tools).run(request, 5, req -> {
			sent.add(req);
			return script.remove(0);
		});

		// Then
		assertThat(result.capped()).isFalse();
		assertThat(result.response().content()).isEqualTo("a is value of a");
		assertThat(result.rounds()).singleElement().satisfies(round ->
				assertThat(round.results()).containsExactly(ToolResult.success("c1", Value.text("value of a"))));
		assertThat(result.usage()).isEqualTo(new TokenUsage(30, 8));
		assertThat(sent).hasSize(2);
		assertThat(sent.get(0).history()).isEmpty();
		assertThat(sent.get(1).history()).hasSize(1);
	}

	@Test
	@DisplayName("should hand unknown tools back to the model as failed results")
	void shouldReportUnknownTool() {
		List<AiResponse> script = new ArrayList<>(List.of(
				AiResponse.toolUse(List.of(new ToolCall("c1", "teleport", null))),
				AiResponse.text("cannot teleport")));

		ToolLoopResult result = new ToolCallingLoop(tools).run(request, 5, req -> script.remove(0));

		ToolResult failed = result.rounds().get(0).results().get(0);
		assertThat(failed.failed()).isTrue();
		assertThat(failed.asText()).isEqualTo("Error: Tool 'teleport' not found");
		assertThat(result.response().content()).isEqualTo("cannot teleport");
	}

	@Test
	@DisplayName("should stop at the round cap and keep the last response")
	void shouldStopAtRoundCap() {
		try (LogCaptor logs = LogCaptor.forClass(ToolCallingLoop.class, Level.WARN)) {
			// Given: a model that never stops calling tools
			int[] counter = {0};

			// When
			ToolLoopResult result = new ToolCallingLoop(tools).run(request, 3,
					req -> AiResponse.toolUse(List.of(lookupCall("c" + (++counter[0]), "x"))));

			// Then
			assertThat(result.capped()).isTrue();
			assertThat(result.rounds()).hasSize(3);
			assertThat(result.response().hasToolCalls()).isTrue();
			assertThat(logs.messagesAt(Level.WARN)).singleElement().asString().contains("after 3 round(s)");
		}
	}

	@Test
	@DisplayName("should return results in call order when tools run concurrently")
	void shouldKeepOrderWithExecutor() {
		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			List<AiResponse> script = new ArrayList<>(List.of(
					AiResponse.toolUse(List.of(lookupCall("c1", "first"), lookupCall("c2", "second"))),
					AiResponse.text("done")));

			ToolLoopResult result = new ToolCallingLoop(tools, ToolExecutionContext.empty(), executor)
					.run(request, 2, req -> script.remove(0));

			assertThat(result.rounds().get(0).results()).extracting(ToolResult::callId).containsExactly("c1", "c2");
			assertThat(result.rounds().get(0).results()).extracting(ToolResult::value)
					.containsExactly(Value.text("value of first"), Value.text("value of second"));
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	@DisplayName("should reject a non-positive round cap")
	void shouldRejectZeroRounds() {
		assertThatThrownBy(() -> new ToolCallingLoop(tools).run(request, 0, req -> AiResponse.text("x")))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
