package com.ironcage.gateway.budget;

/**
 * Outcome of settling a reservation.
 *
 * @param overrun spend now exceeds the limit; the commit still happened
 */
public record CommitResult(Reservation reservation, long actualMicros, BudgetSnapshot budget, boolean overrun) {
}
