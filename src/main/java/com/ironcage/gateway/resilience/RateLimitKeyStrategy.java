package com.ironcage.gateway.resilience;

public enum RateLimitKeyStrategy {
    AGENT,
    AGENT_AND_CAPABILITY;

    public String keyFor(String agentId, String capability) {
        return this == AGENT ? "agent:" + agentId : "agent:" + agentId + ":" + capability;
    }
}
