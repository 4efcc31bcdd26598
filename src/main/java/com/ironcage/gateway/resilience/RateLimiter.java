package com.ironcage.gateway.resilience;

import reactor.core.publisher.Mono;

/**
 * Sliding-window admission keyed by agent and/or endpoint class.
 */
public interface RateLimiter {

    Mono<RateLimitDecision> check(String key);
}
