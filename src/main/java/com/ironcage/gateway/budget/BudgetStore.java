package com.ironcage.gateway.budget;

import reactor.core.publisher.Mono;

/**
 * Ledger persistence collaborator. The {@link BudgetLedger} is the only caller and
 * performs its own per-agent serialization within one gateway instance.
 *
 * A store shared by several instances must also decide admission in
 * {@link #beginReservation}, atomically against the committed spend and open holds of
 * every instance, since each ledger only sees its own holds.
 */
public interface BudgetStore {

    /**
     * @return the stored budget, or empty when the agent has none
     */
    Mono<StoredBudget> getBudget(String agentId);

    /**
     * Records a hold the ledger has admitted locally.
     *
     * @return whether the store admits it too, with the store's committed spend
     */
    Mono<StoreAdmission> beginReservation(Reservation reservation, long limitMicros);

    /**
     * Charges the actual cost and clears the hold, if the store still has one.
     *
     * @return committed spend after the charge
     */
    Mono<Long> commitReservation(Reservation reservation, long actualMicros);

    Mono<Void> releaseReservation(Reservation reservation);
}
