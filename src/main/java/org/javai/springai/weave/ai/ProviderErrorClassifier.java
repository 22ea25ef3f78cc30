package org.javai.springai.weave.ai;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps arbitrary client failures to {@link ProviderException}s.
 *
 * <p>The cause chain is walked once. Network-level failures (timeouts,
 * refused or reset connections) and Spring AI's transient exception type are
 * retryable; an HTTP status found in an exception message is classified by
 * {@link ProviderException#isRetryableStatus}. Anything else is fatal.</p>
 */
public final class ProviderErrorClassifier {

	private static final String TRANSIENT_AI_EXCEPTION = "org.springframework.ai.retry.TransientAiException";
	private static final String NON_TRANSIENT_AI_EXCEPTION = "org.springframework.ai.retry.NonTransientAiException";

	private static final Pattern STATUS = Pattern.compile("\\b([45]\\d\\d)\\b");

	private ProviderErrorClassifier() {
	}

	public static ProviderException classify(Throwable throwable) {
		if (throwable instanceof ProviderException provider) {
			return provider;
		}
		String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
		Set<Throwable> visited = new HashSet<>();
		Throwable current = throwable;
		while (current != null && visited.add(current)) {
			if (current instanceof ProviderException provider) {
				return new ProviderException(message, provider.retryable(), provider.statusCode(), throwable);
			}
			if (isNetworkFailure(current)) {
				return new ProviderException(message, true, null, throwable);
			}
			String className = current.getClass().getName();
			if (TRANSIENT_AI_EXCEPTION.equals(className)) {
				return new ProviderException(message, true, statusIn(current.getMessage()), throwable);
			}
			if (NON_TRANSIENT_AI_EXCEPTION.equals(className)) {
				Integer status = statusIn(current.getMessage());
				return new ProviderException(message, status != null && ProviderException.isRetryableStatus(status),
						status, throwable);
			}
			Integer status = statusIn(current.getMessage());
			if (status != null) {
				return new ProviderException(message, ProviderException.isRetryableStatus(status), status, throwable);
			}
			current = current.getCause();
		}
		return new ProviderException(message, false, null, throwable);
	}

	private static boolean isNetworkFailure(Throwable throwable) {
		if (throwable instanceof SocketTimeoutException
				|| throwable instanceof HttpTimeoutException
				|| throwable instanceof TimeoutException
				|| throwable instanceof ConnectException) {
			return true;
		}
		if (throwable instanceof IOException && throwable.getMessage() != null) {
			String lower = throwable.getMessage().toLowerCase(Locale.ROOT);
			return lower.contains("connection reset") || lower.contains("broken pipe");
		}
		return false;
	}

	private static Integer statusIn(String message) {
		if (message == null) {
			return null;
		}
		Matcher matcher = STATUS.matcher(message);
		return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
	}
}
