package com.ironcage.gateway.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Admission refused by the rate limiter.
 */
@Getter
public class RateLimitedException extends GatewayException {

    private final Duration retryAfter;

    public RateLimitedException(String key, Duration retryAfter) {
        super(ErrorCode.RATE_LIMITED, "Rate limit exceeded for " + key);
        this.retryAfter = retryAfter;
    }
}
