package com.ironcage.gateway.budget;

/**
 * Point-in-time view of one agent's budget, all amounts in micro-dollars.
 */
public record BudgetSnapshot(String agentId, long limitMicros, long spentMicros, long pendingMicros) {

    /**
     * What a new reservation could still claim. Never negative.
     */
    public long availableMicros() {
        return Math.max(0, limitMicros - spentMicros - pendingMicros);
    }

    /**
     * Limit minus committed spend. Never negative.
     */
    public long remainingMicros() {
        return Math.max(0, limitMicros - spentMicros);
    }
}
