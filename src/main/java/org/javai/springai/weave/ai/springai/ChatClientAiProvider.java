package org.javai.springai.weave.ai.springai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.weave.ai.AiPrompts;
import org.javai.springai.weave.ai.AiProvider;
import org.javai.springai.weave.ai.AiRequest;
import org.javai.springai.weave.ai.AiResponse;
import org.javai.springai.weave.ai.ProviderErrorClassifier;
import org.javai.springai.weave.ai.ProviderException;
import org.javai.springai.weave.ai.StopReason;
import org.javai.springai.weave.ai.TokenUsage;
import org.javai.springai.weave.ai.ToolRound;
import org.javai.springai.weave.serialize.WeaveJson;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolResult;
import org.javai.springai.weave.tool.ToolSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * {@link AiProvider} over a Spring AI {@link ChatClient}.
 *
 * <p>Tools are offered to the model as definitions only and Spring AI's
 * internal tool execution is switched off, so tool calls come back in the
 * response and the engine's tool loop runs them. Earlier rounds are replayed
 * as assistant tool-call messages followed by tool response messages.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AiProvider provider = new ChatClientAiProvider(ChatClient.builder(chatModel).build());
 * }</pre>
 */
public class ChatClientAiProvider implements AiProvider {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientAiProvider.class);

	private final ChatClient chatClient;
	private final boolean supportsStructuredOutput;
	private final ObjectMapper mapper = WeaveJson.mapper();

	public ChatClientAiProvider(ChatClient chatClient) {
		this(chatClient, false);
	}

	/**
	 * @param chatClient the client every request goes through
	 * @param supportsStructuredOutput whether the underlying model answers in
	 * JSON mode, in which case typed prompts carry the target type's JSON schema
	 * instead of a textual instruction
	 */
	public ChatClientAiProvider(ChatClient chatClient, boolean supportsStructuredOutput) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.supportsStructuredOutput = supportsStructuredOutput;
	}

	@Override
	public AiResponse execute(AiRequest request) {
		String system = request.operation() == AiOperation.VIBE
				? AiPrompts.CODE_GENERATION_SYSTEM_MESSAGE
				: AiPrompts.SYSTEM_MESSAGE;
		List<Message> messages = baseMessages(system, request);
		for (ToolRound round : request.history()) {
			messages.add(assistantToolCalls(round));
			messages.add(toolResponses(round));
		}
		ChatResponse response = call(new Prompt(messages, options(request)));
		return toAiResponse(response);
	}

	@Override
	public String generateCode(AiRequest request) {
		List<Message> messages = baseMessages(AiPrompts.CODE_GENERATION_SYSTEM_MESSAGE, request);
		ChatResponse response = call(new Prompt(messages, options(request)));
		return textOf(response);
	}

	private List<Message> baseMessages(String system, AiRequest request) {
		List<Message> messages = new ArrayList<>();
		messages.add(new SystemMessage(system));
		String context = AiPrompts.contextMessage(request.contextText());
		if (context != null) {
			messages.add(new UserMessage(context));
		}
		messages.add(new UserMessage(
				AiPrompts.promptMessage(request.prompt(), request.targetType(), supportsStructuredOutput)));
		return messages;
	}

	private ToolCallingChatOptions options(AiRequest request) {
		ToolCallingChatOptions.Builder builder = ToolCallingChatOptions.builder()
				.internalToolExecutionEnabled(false);
		if (request.model().modelName() != null) {
			builder.model(request.model().modelName());
		}
		if (request.hasTools()) {
			List<ToolCallback> callbacks = new ArrayList<>();
			for (ToolSchema schema : request.tools()) {
				callbacks.add(new DefinitionOnlyToolCallback(schema));
			}
			builder.toolCallbacks(callbacks);
		}
		return builder.build();
	}

	private ChatResponse call(Prompt prompt) {
		ChatResponse response;
		try {
			response = chatClient.prompt(prompt).call().chatResponse();
		}
		catch (RuntimeException e) {
			ProviderException classified = ProviderErrorClassifier.classify(e);
			logger.debug("Chat call failed (retryable={}): {}", classified.retryable(), classified.getMessage());
			throw classified;
		}
		if (response == null || response.getResult() == null) {
			throw new ProviderException("Chat model returned no result", false, null);
		}
		return response;
	}

	private AiResponse toAiResponse(ChatResponse response) {
		Generation generation = response.getResult();
		AssistantMessage output = generation.getOutput();
		List<ToolCall> toolCalls = new ArrayList<>();
		if (output.hasToolCalls()) {
			for (AssistantMessage.ToolCall call : output.getToolCalls()) {
				toolCalls.add(new ToolCall(call.id(), call.name(), parseArguments(call)));
			}
		}
		String finishReason = generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null;
		return new AiResponse(textOf(response), null, usageOf(response), toolCalls,
				stopReason(finishReason, !toolCalls.isEmpty()));
	}

	private static String textOf(ChatResponse response) {
		String text = response.getResult().getOutput().getText();
		return text != null ? text : "";
	}

	private JsonNode parseArguments(AssistantMessage.ToolCall call) {
		String arguments = call.arguments();
		if (arguments == null || arguments.isBlank()) {
			return mapper.createObjectNode();
		}
		try {
			return mapper.readTree(arguments);
		}
		catch (JsonProcessingException e) {
			throw new ProviderException("Model returned malformed arguments for tool '" + call.name() + "'", false,
					null, e);
		}
	}

	private static TokenUsage usageOf(ChatResponse response) {
		if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
			return TokenUsage.NONE;
		}
		Usage usage = response.getMetadata().getUsage();
		int input = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
		int output = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
		return new TokenUsage(input, output);
	}

	static StopReason stopReason(String finishReason, boolean hasToolCalls) {
		if (hasToolCalls) {
			return StopReason.TOOL_USE;
		}
		if (finishReason == null) {
			return StopReason.END;
		}
		return switch (finishReason.toLowerCase(Locale.ROOT)) {
			case "length", "max_tokens" -> StopReason.LENGTH;
			case "content_filter", "safety" -> StopReason.CONTENT_FILTER;
			case "tool_calls", "tool_use" -> StopReason.TOOL_USE;
			default -> StopReason.END;
		};
	}

	private static AssistantMessage assistantToolCalls(ToolRound round) {
		List<AssistantMessage.ToolCall> calls = new ArrayList<>();
		for (ToolCall call : round.toolCalls()) {
			calls.add(new AssistantMessage.ToolCall(call.id(), "function", call.toolName(), call.arguments().toString()));
		}
		return new AssistantMessage("", Map.of(), calls);
	}

	private static ToolResponseMessage toolResponses(ToolRound round) {
		List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();
		for (ToolCall call : round.toolCalls()) {
			String data = round.results().stream()
					.filter(result -> result.callId().equals(call.id()))
					.findFirst()
					.map(ToolResult::asText)
					.orElse("Error: no result");
			responses.add(new ToolResponseMessage.ToolResponse(call.id(), call.toolName(), data));
		}
		return new ToolResponseMessage(responses);
	}

	/**
	 * Advertises a tool to the model. Never invoked: internal tool execution is disabled.
	 */
	private static final class DefinitionOnlyToolCallback implements ToolCallback {

		private final ToolDefinition definition;

		DefinitionOnlyToolCallback(ToolSchema schema) {
			this.definition = ToolDefinition.builder()
					.name(schema.name())
					.description(schema.description() != null ? schema.description() : schema.name())
					.inputSchema(schema.inputSchema().toString())
					.build();
		}

		@Override
		public ToolDefinition getToolDefinition() {
			return definition;
		}

		@Override
		public String call(String toolInput) {
			throw new IllegalStateException("Tool '" + definition.name() + "' is executed by the engine");
		}
	}
}
