package org.javai.springai.weave.ai;

import java.time.Duration;

/**
 * Backoff settings for retrying retryable provider failures.
 *
 * <p>The delay before retry {@code n} (zero-based) is
 * {@code min(baseDelay * 2^n * jitter, maxDelay)} with {@code jitter} drawn
 * from [0.5, 1.0]. {@code maxRetries} counts retries, so a policy with
 * {@code maxRetries = 2} makes at most three calls.</p>
 *
 * @param maxRetries retries after the first attempt
 * @param baseDelay delay before the first retry, before jitter
 * @param maxDelay upper bound for any single delay
 */
public record RetryPolicy(
		int maxRetries,
		Duration baseDelay,
		Duration maxDelay
) {

	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
	public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

	public RetryPolicy {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		if (baseDelay == null || baseDelay.isNegative()) {
			throw new IllegalArgumentException("baseDelay must be non-negative");
		}
		if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
			throw new IllegalArgumentException("maxDelay must be >= baseDelay");
		}
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
	}

	/**
	 * A policy that never retries.
	 */
	public static RetryPolicy none() {
		return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
	}

	public RetryPolicy withMaxRetries(int retries) {
		return new RetryPolicy(retries, baseDelay, maxDelay);
	}

	/**
	 * Delay before the retry following failed attempt {@code attempt}
	 * (zero-based).
	 *
	 * @param jitter a factor in [0.5, 1.0]
	 */
	public Duration delayFor(int attempt, double jitter) {
		double millis = baseDelay.toMillis() * Math.pow(2, attempt) * jitter;
		long capped = (long) Math.min(millis, maxDelay.toMillis());
		return Duration.ofMillis(capped);
	}
}
