package com.ironcage.gateway.budget;

/**
 * Budget row as held by the persistence collaborator.
 */
public record StoredBudget(String agentId, long limitMicros, long spentMicros) {
}
