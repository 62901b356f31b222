package io.budgetsakkie.pricebackend.retailer;

import java.time.Duration;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Per-adapter attempt budget. {@code maxRetries} counts every attempt including the first; after
 * attempt {@code n} fails the adapter waits {@code 2^n} backoff units before trying again.
 */
public record RetryPolicy(int maxRetries, Duration backoffUnit, Duration requestTimeout) {

  public static final int DEFAULT_MAX_RETRIES = 3;

  public RetryPolicy {
    maxRetries = Math.max(1, maxRetries);
    backoffUnit = backoffUnit == null || backoffUnit.isNegative() ? Duration.ZERO : backoffUnit;
    requestTimeout =
        requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()
            ? Duration.ofSeconds(10)
            : requestTimeout;
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, Duration.ofSeconds(1), Duration.ofSeconds(10));
  }

  /** Reactor spec; the first retry waits 2 units, the next 4, and so on, without jitter. */
  public RetryBackoffSpec toRetrySpec() {
    return Retry.backoff(maxRetries - 1L, backoffUnit.multipliedBy(2))
        .jitter(0d)
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());
  }
}
