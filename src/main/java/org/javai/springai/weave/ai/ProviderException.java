package org.javai.springai.weave.ai;

import org.javai.springai.weave.WeaveException;

/**
 * A failed provider call. Retryable failures are retried by {@link Retrier};
 * the rest surface immediately.
 */
public class ProviderException extends WeaveException {

	private final boolean retryable;
	private final Integer statusCode;

	public ProviderException(String message, boolean retryable, Integer statusCode) {
		super(message);
		this.retryable = retryable;
		this.statusCode = statusCode;
	}

	public ProviderException(String message, boolean retryable, Integer statusCode, Throwable cause) {
		super(message, cause);
		this.retryable = retryable;
		this.statusCode = statusCode;
	}

	/**
	 * Classifies an HTTP failure: 429 and 5xx are retryable, other statuses are not.
	 */
	public static ProviderException forStatus(int statusCode, String message) {
		return new ProviderException(message, isRetryableStatus(statusCode), statusCode);
	}

	public static boolean isRetryableStatus(int statusCode) {
		return statusCode == 429 || (statusCode >= 500 && statusCode < 600);
	}

	public boolean retryable() {
		return retryable;
	}

	/**
	 * HTTP status of the failed call, {@code null} when there was no response.
	 */
	public Integer statusCode() {
		return statusCode;
	}

	@Override
	public String errorType() {
		return "ProviderError";
	}
}
