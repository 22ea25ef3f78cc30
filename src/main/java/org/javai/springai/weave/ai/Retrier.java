package org.javai.springai.weave.ai;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries provider calls that fail with a retryable {@link ProviderException}.
 * Any other failure, and the last failure once retries are exhausted,
 * propagates unchanged.
 */
public class Retrier {

	private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

	/**
	 * Waits between attempts.
	 */
	@FunctionalInterface
	public interface Sleeper {
		void sleep(Duration duration) throws InterruptedException;
	}

	private final Sleeper sleeper;
	private final DoubleSupplier jitter;

	public Retrier() {
		this(duration -> Thread.sleep(duration.toMillis()), () -> ThreadLocalRandom.current().nextDouble(0.5, 1.0));
	}

	public Retrier(Sleeper sleeper, DoubleSupplier jitter) {
		this.sleeper = sleeper;
		this.jitter = jitter;
	}

	public <T> T withRetry(Supplier<T> call, RetryPolicy policy) {
		int attempt = 0;
		while (true) {
			try {
				return call.get();
			}
			catch (ProviderException e) {
				if (!e.retryable() || attempt >= policy.maxRetries()) {
					throw e;
				}
				Duration delay = policy.delayFor(attempt, jitter.getAsDouble());
				attempt++;
				logger.warn("Retryable provider failure (attempt {} of {}), retrying in {} ms: {}", attempt,
						policy.maxRetries() + 1, delay.toMillis(), e.getMessage());
				pause(delay, e);
			}
		}
	}

	private void pause(Duration delay, ProviderException pending) {
		try {
			sleeper.sleep(delay);
		}
		catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw pending;
		}
	}
}
