package com.ironcage.gateway.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
