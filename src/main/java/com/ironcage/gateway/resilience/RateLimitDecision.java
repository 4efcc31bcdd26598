package com.ironcage.gateway.resilience;

import java.time.Duration;

/**
 * Outcome of a rate limit check: allowed, or limited with a retry-after hint.
 */
public record RateLimitDecision(boolean allowed, long limit, long remaining, Duration retryAfter) {

    public static RateLimitDecision allowed(long limit, long remaining) {
        return new RateLimitDecision(true, limit, remaining, Duration.ZERO);
    }

    public static RateLimitDecision limited(long limit, Duration retryAfter) {
        return new RateLimitDecision(false, limit, 0, retryAfter);
    }
}
