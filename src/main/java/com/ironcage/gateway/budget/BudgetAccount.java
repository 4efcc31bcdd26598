package com.ironcage.gateway.budget;

/**
 * Per-agent counters. Every method is synchronized on the account, which makes the
 * account itself the agent's serialization point. Critical sections are arithmetic only.
 */
final class BudgetAccount {

    private final String agentId;
    private long limitMicros;
    private long spentMicros;
    private long pendingMicros;

    BudgetAccount(String agentId, long limitMicros, long spentMicros) {
        this.agentId = agentId;
        this.limitMicros = limitMicros;
        this.spentMicros = spentMicros;
    }

    /**
     * Adds the amount to pending if committed + pending + amount stays within the limit.
     *
     * @return -1 when admitted, otherwise the amount still available
     */
    synchronized long tryHold(long amountMicros) {
        long available = limitMicros - spentMicros - pendingMicros;
        if (amountMicros > available) {
            return Math.max(0, available);
        }
        pendingMicros += amountMicros;
        return -1;
    }

    synchronized Settlement settle(long heldMicros, long actualMicros) {
        long spentBefore = spentMicros;
        pendingMicros -= heldMicros;
        spentMicros += actualMicros;
        return new Settlement(spentBefore, snapshot());
    }

    synchronized BudgetSnapshot drop(long heldMicros) {
        pendingMicros -= heldMicros;
        return snapshot();
    }

    /**
     * Takes in committed spend reported by the store, which includes other gateway instances.
     * Spend only grows, so a lower figure is a stale read and is ignored.
     */
    synchronized BudgetSnapshot observeSpent(long storedSpentMicros) {
        spentMicros = Math.max(spentMicros, storedSpentMicros);
        return snapshot();
    }

    synchronized long limitMicros() {
        return limitMicros;
    }

    synchronized void updateLimit(long newLimitMicros) {
        this.limitMicros = newLimitMicros;
    }

    synchronized BudgetSnapshot snapshot() {
        return new BudgetSnapshot(agentId, limitMicros, spentMicros, pendingMicros);
    }

    record Settlement(long spentBefore, BudgetSnapshot after) {
    }
}
