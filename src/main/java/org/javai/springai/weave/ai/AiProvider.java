package org.javai.springai.weave.ai;

/**
 * A model vendor behind one interface. Implementations hold all wire-format
 * detail and classify their failures as {@link ProviderException}s, marking
 * transient ones retryable.
 */
public interface AiProvider {

	/**
	 * Sends one request and returns the model's answer, which may ask for tool calls.
	 *
	 * @throws ProviderException if the call fails
	 */
	AiResponse execute(AiRequest request);

	/**
	 * Asks the model for source code implementing the request's prompt.
	 *
	 * @return the raw generated text
	 * @throws ProviderException if the call fails
	 */
	String generateCode(AiRequest request);
}
