package org.javai.springai.weave.ai;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProviderErrorClassifier")
class ProviderErrorClassifierTest {

	@Test
	@DisplayName("should return provider exceptions unchanged")
	void shouldPassThroughProviderExceptions() {
		ProviderException original = ProviderException.forStatus(503, "unavailable");

		assertThat(ProviderErrorClassifier.classify(original)).isSameAs(original);
	}

	@Test
	@DisplayName("should treat timeouts as retryable")
	void shouldRetryTimeouts() {
		ProviderException classified = ProviderErrorClassifier.classify(new SocketTimeoutException("Read timed out"));

		assertThat(classified.retryable()).isTrue();
		assertThat(classified.statusCode()).isNull();
		assertThat(classified.errorType()).isEqualTo("ProviderError");
	}

	@Test
	@DisplayName("should find a network failure deeper in the cause chain")
	void shouldWalkCauseChain() {
		RuntimeException wrapped = new RuntimeException("I/O error on POST request",
				new ConnectException("Connection refused"));

		ProviderException classified = ProviderErrorClassifier.classify(wrapped);

		assertThat(classified.retryable()).isTrue();
		assertThat(classified).hasMessage("I/O error on POST request").hasCause(wrapped);
	}

	@Test
	@DisplayName("should treat a reset connection as retryable")
	void shouldRetryConnectionReset() {
		UncheckedIOException failure = new UncheckedIOException(new IOException("Connection reset by peer"));

		assertThat(ProviderErrorClassifier.classify(failure).retryable()).isTrue();
	}

	@Test
	@DisplayName("should classify by the http status found in the message")
	void shouldClassifyByStatus() {
		ProviderException rateLimited = ProviderErrorClassifier.classify(new RuntimeException("429 Too Many Requests"));
		ProviderException badRequest = ProviderErrorClassifier.classify(new RuntimeException("HTTP 400 - invalid model"));
		ProviderException serverError = ProviderErrorClassifier.classify(new IllegalStateException("upstream returned 502"));

		assertThat(rateLimited.retryable()).isTrue();
		assertThat(rateLimited.statusCode()).isEqualTo(429);
		assertThat(badRequest.retryable()).isFalse();
		assertThat(badRequest.statusCode()).isEqualTo(400);
		assertThat(serverError.retryable()).isTrue();
	}

	@Test
	@DisplayName("should treat anything unrecognised as fatal")
	void shouldDefaultToFatal() {
		ProviderException classified = ProviderErrorClassifier.classify(new IllegalArgumentException());

		assertThat(classified.retryable()).isFalse();
		assertThat(classified).hasMessage("IllegalArgumentException");
	}
}
