package org.javai.springai.weave.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.Level;
import org.javai.springai.weave.testsupport.LogCaptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Retrier")
class RetrierTest {

	private final List<Duration> sleeps = new ArrayList<>();
	private final RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100), Duration.ofSeconds(1));
	private Retrier retrier;
	private LogCaptor logs;

	@BeforeEach
	void setUp() {
		retrier = new Retrier(sleeps::add, () -> 1.0);
		logs = LogCaptor.forClass(Retrier.class, Level.WARN);
	}

	@AfterEach
	void tearDown() {
		logs.close();
	}

	@Test
	@DisplayName("should return the first successful result without sleeping")
	void shouldReturnImmediately() {
		String result = retrier.withRetry(() -> "ok", policy);

		assertThat(result).isEqualTo("ok");
		assertThat(sleeps).isEmpty();
	}

	@Test
	@DisplayName("should retry retryable failures with exponential backoff")
	void shouldRetryWithBackoff() {
		// Given: two transient failures before success
		AtomicInteger calls = new AtomicInteger();

		// When
		String result = retrier.withRetry(() -> {
			if (calls.incrementAndGet() < 3) {
				throw ProviderException.forStatus(503, "Service unavailable");
			}
			return "ok";
		}, policy);

		// Then
		assertThat(result).isEqualTo("ok");
		assertThat(calls).hasValue(3);
		assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
		assertThat(logs.messagesAt(Level.WARN)).hasSize(2)
				.first().asString().contains("attempt 1 of 3", "retrying in 100 ms");
	}

	@Test
	@DisplayName("should rethrow the last failure once retries are exhausted")
	void shouldRethrowWhenExhausted() {
		AtomicInteger calls = new AtomicInteger();

		assertThatThrownBy(() -> retrier.withRetry(() -> {
			throw ProviderException.forStatus(429, "Rate limited " + calls.incrementAndGet());
		}, policy))
				.isInstanceOf(ProviderException.class)
				.hasMessage("Rate limited 3");
		assertThat(sleeps).hasSize(2);
	}

	@Nested
	@DisplayName("non-retryable failures")
	class NonRetryable {

		@Test
		@DisplayName("should not retry a fatal provider failure")
		void shouldNotRetryFatalFailure() {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> retrier.withRetry(() -> {
				calls.incrementAndGet();
				throw ProviderException.forStatus(401, "Unauthorized");
			}, policy))
					.isInstanceOf(ProviderException.class)
					.satisfies(e -> assertThat(((ProviderException) e).statusCode()).isEqualTo(401));
			assertThat(calls).hasValue(1);
			assertThat(sleeps).isEmpty();
			assertThat(logs.events()).isEmpty();
		}

		@Test
		@DisplayName("should let other exceptions through untouched")
		void shouldNotRetryOtherExceptions() {
			IllegalStateException failure = new IllegalStateException("bug");

			assertThatThrownBy(() -> retrier.withRetry(() -> {
				throw failure;
			}, policy)).isSameAs(failure);
		}

		@Test
		@DisplayName("should not retry at all with the none policy")
		void shouldNotRetryWithNonePolicy() {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> retrier.withRetry(() -> {
				calls.incrementAndGet();
				throw ProviderException.forStatus(500, "boom");
			}, RetryPolicy.none())).isInstanceOf(ProviderException.class);
			assertThat(calls).hasValue(1);
		}
	}

	@Test
	@DisplayName("should stop retrying and restore the interrupt flag when interrupted")
	void shouldStopWhenInterrupted() {
		Retrier interrupted = new Retrier(duration -> {
			throw new InterruptedException();
		}, () -> 1.0);

		try {
			assertThatThrownBy(() -> interrupted.withRetry(() -> {
				throw ProviderException.forStatus(502, "Bad gateway");
			}, policy)).hasMessage("Bad gateway");
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}
		finally {
			Thread.interrupted();
		}
	}

	@Nested
	@DisplayName("RetryPolicy")
	class Policy {

		@Test
		@DisplayName("should double the delay per attempt and cap it")
		void shouldComputeDelays() {
			RetryPolicy capped = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(3));

			assertThat(capped.delayFor(0, 0.5)).isEqualTo(Duration.ofMillis(500));
			assertThat(capped.delayFor(1, 1.0)).isEqualTo(Duration.ofSeconds(2));
			assertThat(capped.delayFor(3, 1.0)).isEqualTo(Duration.ofSeconds(3));
		}

		@Test
		@DisplayName("should reject a max delay below the base delay")
		void shouldValidate() {
			assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(2), Duration.ofSeconds(1)))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> RetryPolicy.defaults().withMaxRetries(-1))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}
}
