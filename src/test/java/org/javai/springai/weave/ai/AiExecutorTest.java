package org.javai.springai.weave.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;
import java.util.List;
import org.javai.springai.weave.EngineConfig;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.state.PendingRequest;
import org.javai.springai.weave.testsupport.ScriptedAiProvider;
import org.javai.springai.weave.tool.Tool;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolRegistry;
import org.javai.springai.weave.tool.ToolSchema;
import org.javai.springai.weave.value.TargetType;
import org.javai.springai.weave.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AiExecutor")
class AiExecutorTest {

	private static final RetryPolicy FAST_RETRIES = new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(10));

	private ScriptedAiProvider provider;
	private ToolRegistry tools;

	@BeforeEach
	void setUp() {
		provider = new ScriptedAiProvider();
		tools = ToolRegistry.builder()
				.tool(Tool.of(ToolSchema.builder("lookup").parameter("key", "string", null, true).build(),
						(arguments, context) -> "found " + arguments.get("key").asText()))
				.build();
	}

	private AiExecutor executor(EngineConfig config) {
		return new AiExecutor(provider, tools, config, new Retrier(duration -> {
		}, () -> 1.0), new ToolCallingLoop(tools));
	}

	private AiExecutor executor() {
		return executor(EngineConfig.builder().retryPolicy(FAST_RETRIES).build());
	}

	private static PendingRequest.PendingAi pending(AiOperation operation, ModelConfig model) {
		return new PendingRequest.PendingAi(operation, "How many?", model, TargetType.NUMBER, "  main (current scope)",
				model.tools());
	}

	@Nested
	@DisplayName("do")
	class Do {

		@Test
		@DisplayName("should send prompt, context and target type in one request")
		void shouldSendSingleRequest() {
			provider.respond("4");

			AiOutcome outcome = executor().execute(pending(AiOperation.DO, ModelConfig.named("default")));

			assertThat(outcome.content()).isEqualTo("4");
			assertThat(outcome.toolRounds()).isEmpty();
			AiRequest request = provider.requests().get(0);
			assertThat(request.prompt()).isEqualTo("How many?");
			assertThat(request.contextText()).isEqualTo("  main (current scope)");
			assertThat(request.targetType()).isEqualTo(TargetType.NUMBER);
			assertThat(request.hasTools()).isFalse();
		}

		@Test
		@DisplayName("should run a tool conversation when the model has tools")
		void shouldRunToolConversation() {
			ToolCall call = new ToolCall("t1", "lookup", JsonNodeFactory.instance.objectNode().put("key", "a"));
			provider.respond(AiResponse.toolUse(List.of(call))).respond("7");
			ModelConfig model = ModelConfig.builder("default").tools(List.of("lookup")).build();

			AiOutcome outcome = executor().execute(pending(AiOperation.DO, model));

			assertThat(outcome.content()).isEqualTo("7");
			assertThat(outcome.toolRounds()).singleElement()
					.satisfies(round -> assertThat(round.results().get(0).value()).isEqualTo(Value.text("found a")));
			assertThat(provider.requests().get(0).tools()).extracting(ToolSchema::name).containsExactly("lookup");
		}

		@Test
		@DisplayName("should render a structured-only response back to text")
		void shouldRenderParsedValue() {
			provider.respond(new AiResponse("", Value.number(4), TokenUsage.NONE, List.of(), StopReason.END));

			AiOutcome outcome = executor().execute(pending(AiOperation.DO, ModelConfig.named("default")));

			assertThat(outcome.content()).isEqualTo("4");
		}
	}

	@Nested
	@DisplayName("retries")
	class Retries {

		@Test
		@DisplayName("should retry transient provider failures")
		void shouldRetryTransientFailures() {
			provider.fail(ProviderException.forStatus(503, "unavailable")).respond("4");

			AiOutcome outcome = executor().execute(pending(AiOperation.DO, ModelConfig.named("default")));

			assertThat(outcome.content()).isEqualTo("4");
			assertThat(provider.requests()).hasSize(2);
		}

		@Test
		@DisplayName("should honour the model's own retry limit")
		void shouldUseModelRetryOverride() {
			provider.fail(ProviderException.forStatus(503, "unavailable")).respond("4");
			ModelConfig model = ModelConfig.builder("strict").maxRetriesOnError(0).build();

			assertThatThrownBy(() -> executor().execute(pending(AiOperation.DO, model)))
					.isInstanceOf(ProviderException.class);
			assertThat(provider.requests()).hasSize(1);
		}

		@Test
		@DisplayName("should not retry loop summaries unless configured")
		void shouldNotRetryCompressByDefault() {
			provider.fail(ProviderException.forStatus(503, "unavailable")).respond("summary");

			assertThatThrownBy(() -> executor().execute(pending(AiOperation.COMPRESS, ModelConfig.named("default"))))
					.isInstanceOf(ProviderException.class);
			assertThat(provider.requests()).hasSize(1);
		}

		@Test
		@DisplayName("should retry loop summaries when configured")
		void shouldRetryCompressWhenConfigured() {
			provider.fail(ProviderException.forStatus(503, "unavailable")).respond("summary");
			AiExecutor retrying = executor(EngineConfig.builder().retryPolicy(FAST_RETRIES).retryCompress(true).build());

			AiOutcome outcome = retrying.execute(pending(AiOperation.COMPRESS, ModelConfig.named("default")));

			assertThat(outcome.content()).isEqualTo("summary");
		}
	}

	@Test
	@DisplayName("should ask for code generation for vibe without tools")
	void shouldGenerateCodeForVibe() {
		provider.respond("{\"kind\":\"Function\"}");

		AiOutcome outcome = executor().execute(new PendingRequest.PendingAi(AiOperation.VIBE, "add a and b",
				ModelConfig.named("default"), null, "", List.of()));

		assertThat(outcome.content()).isEqualTo("{\"kind\":\"Function\"}");
		assertThat(provider.requests()).singleElement()
				.satisfies(request -> assertThat(request.operation()).isEqualTo(AiOperation.VIBE));
	}

	@Test
	@DisplayName("should refuse ask requests")
	void shouldRefuseAsk() {
		assertThatThrownBy(() -> executor().execute(new PendingRequest.PendingAi(AiOperation.ASK, "Name?",
				ModelConfig.named("default"), null, "", List.of())))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(provider.requests()).isEmpty();
	}
}
