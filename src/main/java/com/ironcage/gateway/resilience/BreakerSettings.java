package com.ironcage.gateway.resilience;

import java.time.Duration;

/**
 * @param failureThreshold failed calls, counted over the last {@code failureThreshold} outcomes, that open the breaker
 * @param cooldown         time spent open before a single trial call is allowed
 */
public record BreakerSettings(int failureThreshold, Duration cooldown) {

    public BreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive");
        }
    }
}
