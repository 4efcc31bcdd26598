package com.ironcage.gateway.resilience;

/**
 * Read-only view of one breaker for the health endpoint.
 */
public record BreakerSnapshot(CircuitState state, int failures) {
}
