package com.ironcage.gateway.resilience;

import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff and jitter, applied to a single provider.
 *
 * Attempt {@code n + 1} waits {@code min(maxDelay, baseDelay * 2^(n-1))}, spread by
 * {@code jitterFactor} in both directions. Once {@code maxAttempts} attempts have failed the
 * last error is propagated as is.
 */
public record RetryPolicy(int maxAttempts,
                          Duration baseDelay,
                          Duration maxDelay,
                          double jitterFactor) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelay <= maxDelay");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    public boolean retries() {
        return maxAttempts > 1;
    }

    /**
     * Reactor retry spec for {@code Mono#retryWhen}. Only errors accepted by {@code retryable}
     * are retried.
     */
    public RetryBackoffSpec toRetrySpec(Predicate<Throwable> retryable) {
        return Retry.backoff(maxAttempts - 1L, baseDelay)
                .maxBackoff(maxDelay)
                .jitter(jitterFactor)
                .filter(retryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
