package org.javai.springai.weave.ai;

import org.javai.springai.weave.value.TargetType;

/**
 * Message texts shared by provider adapters. A chat request is a system
 * message, an optional context message and the prompt message, in that
 * order. The wording is part of what the model sees; change it deliberately.
 */
public final class AiPrompts {

	public static final String SYSTEM_MESSAGE = """
			You are an AI assistant integrated into the Weave runtime.
			Your responses will be used programmatically in the execution flow.
			Be concise and precise. Follow any type constraints exactly.
			When context is provided, use it to inform your response.""";

	public static final String CODE_GENERATION_SYSTEM_MESSAGE = """
			You write functions for the Weave runtime.
			Reply with exactly one function declaration encoded as a JSON syntax tree and nothing else.
			The root object has "kind": "Function", a "name", a "params" array of {"name", "type"} objects,
			an optional "returnType" and a "body" array of statement objects.
			Statements and expressions are objects tagged by "kind", for example
			{"kind":"Return","value":{"kind":"Binary","operator":"ADD","left":{"kind":"Identifier","name":"a"},"right":{"kind":"Number","value":1}}}.
			The function is called immediately with the values of the caller's variables named like its parameters.""";

	public static final String CONTEXT_PREFIX = "Here is the current program context:\n\n";

	public static final String SCHEMA_PREFIX = "Your response must be JSON conforming to this schema:\n";

	private AiPrompts() {
	}

	/**
	 * The context message, or {@code null} when there is no context to send.
	 */
	public static String contextMessage(String contextText) {
		if (contextText == null || contextText.isBlank()) {
			return null;
		}
		return CONTEXT_PREFIX + contextText.trim();
	}

	/**
	 * The prompt with the target type's constraint appended. A provider that
	 * enforces structured output gets the type's JSON schema; any other gets
	 * the textual instruction. Plain text is never constrained; JSON targets
	 * always get the instruction, their shape being unknown.
	 *
	 * @param prompt the prompt text as evaluated by the program
	 * @param targetType the expected response type, or {@code null} for none
	 * @param supportsStructuredOutput whether the model answers in JSON mode
	 * @return the message text to send
	 */
	public static String promptMessage(String prompt, TargetType targetType, boolean supportsStructuredOutput) {
		if (targetType == null || targetType == TargetType.TEXT) {
			return prompt;
		}
		if (supportsStructuredOutput && !targetType.requiresInstruction()) {
			return prompt + "\n\n" + SCHEMA_PREFIX + targetType.schema();
		}
		return prompt + "\n\n" + targetType.instruction();
	}
}
