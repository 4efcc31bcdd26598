package com.ironcage.gateway.budget;

/**
 * Receives ledger signals. Called outside the ledger's critical section and must not block.
 */
public interface BudgetEventListener {

    BudgetEventListener NOOP = new BudgetEventListener() {
    };

    /**
     * Committed spend crossed the soft threshold with this commit.
     */
    default void onSoftThresholdCrossed(BudgetSnapshot budget, int thresholdPercent) {
    }

    /**
     * A commit pushed committed spend above the limit.
     */
    default void onOverrun(BudgetSnapshot budget, Reservation reservation, long actualMicros) {
    }

    /**
     * The sweeper released a reservation nobody resolved in time.
     */
    default void onReservationExpired(Reservation reservation) {
    }
}
