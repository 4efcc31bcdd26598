package com.ironcage.gateway.budget;

import com.ironcage.gateway.exception.BudgetExceededException;
import com.ironcage.gateway.exception.GatewayException;
import com.ironcage.gateway.exception.LedgerUnavailableException;
import com.ironcage.gateway.exception.ReservationAlreadyResolvedException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent spend ledger with atomic reserve / commit / release.
 *
 * Admission is decided under the agent's account lock: committed spend plus every
 * outstanding reservation plus the new estimate must fit in the limit, so two requests
 * racing a nearly exhausted budget are never both admitted. Persistence calls to the
 * {@link BudgetStore} happen after the lock is released.
 *
 * Each reservation is resolved exactly once. Resolution is claimed by removing the
 * reservation from the outstanding map, so commit, release and the expiry sweep can race
 * and only one of them wins. A commit of an already resolved reservation is rejected;
 * a release of one is a no-op returning {@code false}. The one exception is a reservation
 * the sweep expired: its request may still finish, and its first commit charges the actual
 * cost against committed spend.
 *
 * Commit charges the actual cost, which may exceed the reservation. An over-limit commit
 * still succeeds and is reported as an overrun; enforcement happens at admission.
 *
 * With a store shared between gateway instances the store has the final say on admission;
 * every answer it gives refreshes the local view of committed spend.
 */
@Slf4j
public class BudgetLedger {

    private final BudgetStore store;
    private final BudgetEventListener listener;
    private final Clock clock;
    private final Duration reservationTtl;
    private final int softThresholdPercent;

    private final ConcurrentHashMap<String, BudgetAccount> accounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Reservation> outstanding = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Reservation> expiredUncharged = new ConcurrentHashMap<>();

    public BudgetLedger(BudgetStore store,
                        BudgetEventListener listener,
                        Clock clock,
                        Duration reservationTtl,
                        int softThresholdPercent) {
        this.store = store;
        this.listener = listener;
        this.clock = clock;
        this.reservationTtl = reservationTtl;
        this.softThresholdPercent = softThresholdPercent;
    }

    // ==================== RESERVE ====================

    public Mono<Reservation> reserve(String agentId, long estimatedMicros) {
        if (estimatedMicros < 0) {
            return Mono.error(new IllegalArgumentException("Estimated cost must not be negative"));
        }
        return account(agentId).flatMap(account -> {
            long refusedWithAvailable = account.tryHold(estimatedMicros);
            if (refusedWithAvailable >= 0) {
                log.info("Budget exceeded for agent {}: requested {} micros, available {} micros",
                        agentId, estimatedMicros, refusedWithAvailable);
                return Mono.error(new BudgetExceededException(agentId, estimatedMicros, refusedWithAvailable));
            }

            Instant now = clock.instant();
            Reservation reservation = new Reservation(UUID.randomUUID().toString(), agentId,
                    estimatedMicros, now, now.plus(reservationTtl));
            outstanding.put(reservation.id(), reservation);
            log.debug("Reserved {} micros for agent {} ({})", estimatedMicros, agentId, reservation.id());

            return store.beginReservation(reservation, account.limitMicros())
                    .switchIfEmpty(Mono.error(new IllegalStateException("Store returned no admission")))
                    .onErrorResume(e -> {
                        withdraw(reservation, account);
                        return Mono.error(new LedgerUnavailableException(
                                "Reservation for agent " + agentId + " could not be recorded", e));
                    })
                    .flatMap(admission -> {
                        account.observeSpent(admission.spentMicros());
                        if (admission.admitted()) {
                            return Mono.just(reservation);
                        }
                        withdraw(reservation, account);
                        return Mono.error(new BudgetExceededException(agentId, estimatedMicros, admission.availableMicros()));
                    });
        });
    }

    // ==================== COMMIT ====================

    public Mono<CommitResult> commit(String reservationId, long actualMicros) {
        return Mono.defer(() -> {
            if (actualMicros < 0) {
                return Mono.error(new IllegalArgumentException("Actual cost must not be negative"));
            }
            Reservation reservation = outstanding.remove(reservationId);
            if (reservation != null) {
                return charge(reservation, reservation.amountMicros(), actualMicros);
            }
            Reservation expired = expiredUncharged.remove(reservationId);
            if (expired != null) {
                log.warn("Charging {} micros to agent {} for reservation {} that expired before its request finished",
                        actualMicros, expired.agentId(), reservationId);
                return charge(expired, 0L, actualMicros);
            }
            log.warn("Rejected commit of resolved reservation {}", reservationId);
            return Mono.error(new ReservationAlreadyResolvedException(reservationId));
        });
    }

    // ==================== RELEASE ====================

    public Mono<Boolean> release(String reservationId) {
        return Mono.defer(() -> {
            Reservation reservation = outstanding.remove(reservationId);
            if (reservation == null) {
                log.debug("Reservation {} already resolved, release ignored", reservationId);
                return Mono.just(false);
            }
            accounts.get(reservation.agentId()).drop(reservation.amountMicros());
            log.debug("Released {} micros for agent {} ({})",
                    reservation.amountMicros(), reservation.agentId(), reservationId);
            return store.releaseReservation(reservation)
                    .onErrorResume(e -> logPersistenceFailure("release", reservation, e))
                    .thenReturn(true);
        });
    }

    /**
     * Releases every reservation whose expiry has passed. A request that still finishes
     * afterwards is charged by its commit.
     *
     * @return number of reservations released by this sweep
     */
    public Mono<Long> sweepExpired() {
        Instant now = clock.instant();
        expiredUncharged.values().removeIf(reservation -> !now.isBefore(reservation.expiresAt().plus(reservationTtl)));
        List<Reservation> expired = outstanding.values().stream()
                .filter(reservation -> reservation.isExpired(now))
                .toList();
        return Flux.fromIterable(expired)
                .concatMap(reservation -> expire(reservation)
                        .filter(Boolean::booleanValue)
                        .doOnNext(released -> {
                            log.warn("Released expired reservation {} for agent {} ({} micros)",
                                    reservation.id(), reservation.agentId(), reservation.amountMicros());
                            listener.onReservationExpired(reservation);
                        }))
                .count();
    }

    // ==================== QUERIES ====================

    public Mono<BudgetSnapshot> snapshot(String agentId) {
        return account(agentId).map(BudgetAccount::snapshot);
    }

    public int outstandingCount() {
        return outstanding.size();
    }

    public boolean isOutstanding(String reservationId) {
        return outstanding.containsKey(reservationId);
    }

    /**
     * Applies a limit change from the provisioning collaborator to an already loaded account.
     */
    public void updateLimit(String agentId, long limitMicros) {
        BudgetAccount account = accounts.get(agentId);
        if (account != null) {
            account.updateLimit(limitMicros);
        }
    }

    // ==================== HELPER METHODS ====================

    private Mono<CommitResult> charge(Reservation reservation, long heldMicros, long actualMicros) {
        BudgetAccount account = accounts.get(reservation.agentId());
        BudgetAccount.Settlement settlement = account.settle(heldMicros, actualMicros);
        BudgetSnapshot after = settlement.after();
        boolean overrun = after.spentMicros() > after.limitMicros();

        if (crossedSoftThreshold(settlement.spentBefore(), after)) {
            log.warn("Agent {} passed {}% of its budget ({} of {} micros)",
                    after.agentId(), softThresholdPercent, after.spentMicros(), after.limitMicros());
            listener.onSoftThresholdCrossed(after, softThresholdPercent);
        }
        if (overrun) {
            log.warn("Budget overrun for agent {}: spent {} micros against limit {} (reserved {}, actual {})",
                    after.agentId(), after.spentMicros(), after.limitMicros(),
                    reservation.amountMicros(), actualMicros);
            listener.onOverrun(after, reservation, actualMicros);
        }

        return store.commitReservation(reservation, actualMicros)
                .map(account::observeSpent)
                .onErrorResume(e -> logPersistenceFailure("commit", reservation, e))
                .defaultIfEmpty(after)
                .map(budget -> new CommitResult(reservation, actualMicros, budget, overrun));
    }

    /**
     * Resolves the reservation as expired. It is parked as uncharged before it leaves the
     * outstanding map so a commit racing the sweep always finds it in one of the two.
     */
    private Mono<Boolean> expire(Reservation reservation) {
        return Mono.defer(() -> {
            expiredUncharged.put(reservation.id(), reservation);
            if (!outstanding.remove(reservation.id(), reservation)) {
                expiredUncharged.remove(reservation.id());
                return Mono.just(false);
            }
            accounts.get(reservation.agentId()).drop(reservation.amountMicros());
            return store.releaseReservation(reservation)
                    .onErrorResume(e -> logPersistenceFailure("release", reservation, e))
                    .thenReturn(true);
        });
    }

    private void withdraw(Reservation reservation, BudgetAccount account) {
        if (outstanding.remove(reservation.id(), reservation)) {
            account.drop(reservation.amountMicros());
        }
    }

    private Mono<BudgetAccount> account(String agentId) {
        BudgetAccount existing = accounts.get(agentId);
        if (existing != null) {
            return Mono.just(existing);
        }
        return store.getBudget(agentId)
                .switchIfEmpty(Mono.error(new LedgerUnavailableException("No budget provisioned for agent " + agentId)))
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> new LedgerUnavailableException("Budget for agent " + agentId + " could not be loaded", e))
                .map(stored -> accounts.computeIfAbsent(agentId,
                        id -> new BudgetAccount(id, stored.limitMicros(), stored.spentMicros())));
    }

    private boolean crossedSoftThreshold(long spentBefore, BudgetSnapshot after) {
        if (after.limitMicros() <= 0) {
            return false;
        }
        long thresholdMicros = after.limitMicros() * softThresholdPercent / 100;
        return spentBefore < thresholdMicros && after.spentMicros() >= thresholdMicros;
    }

    private <T> Mono<T> logPersistenceFailure(String operation, Reservation reservation, Throwable e) {
        log.error("Ledger store {} failed for reservation {} of agent {}: {}",
                operation, reservation.id(), reservation.agentId(), e.getMessage());
        return Mono.empty();
    }
}
