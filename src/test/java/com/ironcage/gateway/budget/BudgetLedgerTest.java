package com.ironcage.gateway.budget;

import com.ironcage.gateway.directory.AgentRecord;
import com.ironcage.gateway.directory.InMemoryAgentDirectory;
import com.ironcage.gateway.exception.BudgetExceededException;
import com.ironcage.gateway.exception.LedgerUnavailableException;
import com.ironcage.gateway.exception.ReservationAlreadyResolvedException;
import com.ironcage.gateway.pricing.Money;
import com.ironcage.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BudgetLedgerTest {

    private static final String AGENT = "agent-1";

    private MutableClock clock;
    private InMemoryAgentDirectory directory;
    private InMemoryBudgetStore store;
    private RecordingListener listener;
    private BudgetLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        directory = new InMemoryAgentDirectory();
        directory.save(new AgentRecord(AGENT, usd(10), Set.of("openai"), "token-1"));
        store = new InMemoryBudgetStore(directory);
        listener = new RecordingListener();
        ledger = new BudgetLedger(store, listener, clock, Duration.ofMinutes(5), 90);
    }

    @Test
    void concurrentReservationsShouldNeverOverAdmit() throws Exception {
        List<Boolean> outcomes = runConcurrently(3, () -> reserveQuietly(usd(4)));

        assertThat(outcomes).filteredOn(Boolean::booleanValue).hasSize(2);
        assertThat(ledger.snapshot(AGENT).block().pendingMicros()).isEqualTo(usd(8));
    }

    @Test
    void manyConcurrentReservationsShouldFillBudgetExactly() throws Exception {
        List<Boolean> outcomes = runConcurrently(64, () -> reserveQuietly(usd(1)));

        assertThat(outcomes).filteredOn(Boolean::booleanValue).hasSize(10);
        BudgetSnapshot snapshot = ledger.snapshot(AGENT).block();
        assertThat(snapshot.spentMicros() + snapshot.pendingMicros()).isLessThanOrEqualTo(snapshot.limitMicros());
        assertThat(snapshot.availableMicros()).isZero();
    }

    @Test
    void reserveShouldReportRemainingWhenRefused() {
        ledger.reserve(AGENT, usd(7)).block();

        StepVerifier.create(ledger.reserve(AGENT, usd(4)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BudgetExceededException.class);
                    BudgetExceededException exceeded = (BudgetExceededException) error;
                    assertThat(exceeded.getRequestedMicros()).isEqualTo(usd(4));
                    assertThat(exceeded.getRemainingMicros()).isEqualTo(usd(3));
                })
                .verify();
    }

    @Test
    void releaseShouldMakeBudgetAvailableAgain() {
        Reservation first = ledger.reserve(AGENT, usd(4)).block();
        ledger.reserve(AGENT, usd(4)).block();

        StepVerifier.create(ledger.reserve(AGENT, usd(4)))
                .expectError(BudgetExceededException.class)
                .verify();

        StepVerifier.create(ledger.release(first.id()))
                .expectNext(true)
                .verifyComplete();

        StepVerifier.create(ledger.reserve(AGENT, usd(4)))
                .assertNext(reservation -> assertThat(reservation.amountMicros()).isEqualTo(usd(4)))
                .verifyComplete();
    }

    @Test
    void commitShouldChargeActualCostAndClearPending() {
        Reservation reservation = ledger.reserve(AGENT, usd(4)).block();

        StepVerifier.create(ledger.commit(reservation.id(), usd(3)))
                .assertNext(result -> {
                    assertThat(result.actualMicros()).isEqualTo(usd(3));
                    assertThat(result.overrun()).isFalse();
                    assertThat(result.budget().spentMicros()).isEqualTo(usd(3));
                    assertThat(result.budget().pendingMicros()).isZero();
                    assertThat(result.budget().remainingMicros()).isEqualTo(usd(7));
                })
                .verifyComplete();

        assertThat(store.spentMicros(AGENT)).isEqualTo(usd(3));
        assertThat(store.openReservations()).isZero();
        assertThat(ledger.outstandingCount()).isZero();
    }

    @Test
    void duplicateCommitShouldBeRejectedAndChargedOnce() {
        Reservation reservation = ledger.reserve(AGENT, usd(2)).block();
        ledger.commit(reservation.id(), usd(2)).block();

        StepVerifier.create(ledger.commit(reservation.id(), usd(2)))
                .expectError(ReservationAlreadyResolvedException.class)
                .verify();

        assertThat(ledger.snapshot(AGENT).block().spentMicros()).isEqualTo(usd(2));
    }

    @Test
    void releaseAfterCommitShouldBeNoOp() {
        Reservation reservation = ledger.reserve(AGENT, usd(2)).block();
        ledger.commit(reservation.id(), usd(1)).block();

        StepVerifier.create(ledger.release(reservation.id()))
                .expectNext(false)
                .verifyComplete();

        BudgetSnapshot snapshot = ledger.snapshot(AGENT).block();
        assertThat(snapshot.spentMicros()).isEqualTo(usd(1));
        assertThat(snapshot.pendingMicros()).isZero();
    }

    @Test
    void overLimitCommitShouldSucceedAndSignalOverrun() {
        Reservation reservation = ledger.reserve(AGENT, usd(9)).block();

        StepVerifier.create(ledger.commit(reservation.id(), usd(12)))
                .assertNext(result -> {
                    assertThat(result.overrun()).isTrue();
                    assertThat(result.budget().spentMicros()).isEqualTo(usd(12));
                    assertThat(result.budget().remainingMicros()).isZero();
                })
                .verifyComplete();

        assertThat(listener.overruns).hasSize(1);
        StepVerifier.create(ledger.reserve(AGENT, 1))
                .expectError(BudgetExceededException.class)
                .verify();
    }

    @Test
    void crossingSoftThresholdShouldSignalOnce() {
        Reservation first = ledger.reserve(AGENT, usd(5)).block();
        ledger.commit(first.id(), usd(5)).block();
        assertThat(listener.thresholdCrossings).isEmpty();

        Reservation second = ledger.reserve(AGENT, usd(4)).block();
        ledger.commit(second.id(), usd(4)).block();
        assertThat(listener.thresholdCrossings).hasSize(1);
        assertThat(listener.thresholdCrossings.get(0).spentMicros()).isEqualTo(usd(9));

        Reservation third = ledger.reserve(AGENT, Money.usdToMicros(0.5)).block();
        ledger.commit(third.id(), Money.usdToMicros(0.5)).block();
        assertThat(listener.thresholdCrossings).hasSize(1);
    }

    @Test
    void sweepShouldReleaseOnlyExpiredReservations() {
        Reservation stale = ledger.reserve(AGENT, usd(4)).block();
        clock.advance(Duration.ofMinutes(3));
        Reservation fresh = ledger.reserve(AGENT, usd(2)).block();
        clock.advance(Duration.ofMinutes(3));

        StepVerifier.create(ledger.sweepExpired())
                .expectNext(1L)
                .verifyComplete();

        assertThat(listener.expired).extracting(Reservation::id).containsExactly(stale.id());
        assertThat(ledger.isOutstanding(fresh.id())).isTrue();
        assertThat(ledger.snapshot(AGENT).block().pendingMicros()).isEqualTo(usd(2));
    }

    @Test
    void commitAfterExpiryShouldChargeActualCostOnce() {
        Reservation reservation = ledger.reserve(AGENT, usd(4)).block();
        clock.advance(Duration.ofMinutes(6));
        ledger.sweepExpired().block();
        assertThat(ledger.snapshot(AGENT).block().pendingMicros()).isZero();

        StepVerifier.create(ledger.commit(reservation.id(), usd(3)))
                .assertNext(result -> {
                    assertThat(result.budget().spentMicros()).isEqualTo(usd(3));
                    assertThat(result.budget().pendingMicros()).isZero();
                })
                .verifyComplete();
        StepVerifier.create(ledger.commit(reservation.id(), usd(3)))
                .expectError(ReservationAlreadyResolvedException.class)
                .verify();

        assertThat(store.spentMicros(AGENT)).isEqualTo(usd(3));
        assertThat(store.openReservations()).isZero();
    }

    @Test
    void expiredReservationShouldStopBeingChargeableAfterAnotherTtl() {
        Reservation reservation = ledger.reserve(AGENT, usd(4)).block();
        clock.advance(Duration.ofMinutes(6));
        ledger.sweepExpired().block();
        clock.advance(Duration.ofMinutes(5));
        ledger.sweepExpired().block();

        StepVerifier.create(ledger.commit(reservation.id(), usd(3)))
                .expectError(ReservationAlreadyResolvedException.class)
                .verify();
        assertThat(ledger.snapshot(AGENT).block().spentMicros()).isZero();
    }

    @Test
    void releaseOfExpiredReservationShouldBeNoOp() {
        Reservation reservation = ledger.reserve(AGENT, usd(4)).block();
        clock.advance(Duration.ofMinutes(6));
        ledger.sweepExpired().block();

        StepVerifier.create(ledger.release(reservation.id()))
                .expectNext(false)
                .verifyComplete();
        assertThat(ledger.snapshot(AGENT).block().pendingMicros()).isZero();
    }

    @Test
    void unknownAgentShouldBeLedgerUnavailable() {
        StepVerifier.create(ledger.reserve("ghost", usd(1)))
                .expectError(LedgerUnavailableException.class)
                .verify();
    }

    @Test
    void storeLoadFailureShouldBeLedgerUnavailable() {
        BudgetStore failing = mock(BudgetStore.class);
        when(failing.getBudget(AGENT)).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        BudgetLedger failingLedger = new BudgetLedger(failing, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90);

        StepVerifier.create(failingLedger.reserve(AGENT, usd(1)))
                .expectError(LedgerUnavailableException.class)
                .verify();
    }

    @Test
    void storeWriteFailureShouldNotFailCommit() {
        BudgetStore flaky = mock(BudgetStore.class);
        when(flaky.getBudget(AGENT)).thenReturn(Mono.just(new StoredBudget(AGENT, usd(10), 0)));
        when(flaky.beginReservation(any(), anyLong())).thenReturn(Mono.just(StoreAdmission.admitted(0)));
        when(flaky.commitReservation(any(), anyLong())).thenReturn(Mono.error(new IllegalStateException("timeout")));
        BudgetLedger flakyLedger = new BudgetLedger(flaky, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90);

        Reservation reservation = flakyLedger.reserve(AGENT, usd(1)).block();

        StepVerifier.create(flakyLedger.commit(reservation.id(), usd(1)))
                .assertNext(result -> assertThat(result.budget().spentMicros()).isEqualTo(usd(1)))
                .verifyComplete();
    }

    @Test
    void storeAdmissionFailureShouldBeLedgerUnavailable() {
        BudgetStore failing = mock(BudgetStore.class);
        when(failing.getBudget(AGENT)).thenReturn(Mono.just(new StoredBudget(AGENT, usd(10), 0)));
        when(failing.beginReservation(any(), anyLong())).thenReturn(Mono.error(new IllegalStateException("timeout")));
        BudgetLedger failingLedger = new BudgetLedger(failing, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90);

        StepVerifier.create(failingLedger.reserve(AGENT, usd(1)))
                .expectError(LedgerUnavailableException.class)
                .verify();

        assertThat(failingLedger.outstandingCount()).isZero();
        assertThat(failingLedger.snapshot(AGENT).block().pendingMicros()).isZero();
    }

    // ==================== SHARED STORE ====================

    @Test
    void sharedStoreShouldRefuseSpendCommittedByAnotherInstance() {
        SharedBudgetStore shared = new SharedBudgetStore(usd(10));
        BudgetLedger first = new BudgetLedger(shared, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90);
        BudgetLedger second = new BudgetLedger(shared, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90);
        assertThat(second.snapshot(AGENT).block().spentMicros()).isZero();

        Reservation reservation = first.reserve(AGENT, usd(10)).block();
        first.commit(reservation.id(), usd(10)).block();

        StepVerifier.create(second.reserve(AGENT, usd(1)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BudgetExceededException.class);
                    assertThat(((BudgetExceededException) error).getRemainingMicros()).isZero();
                })
                .verify();

        assertThat(second.outstandingCount()).isZero();
        assertThat(second.snapshot(AGENT).block().spentMicros()).isEqualTo(usd(10));
    }

    @Test
    void sharedStoreShouldNeverOverAdmitAcrossInstances() throws Exception {
        SharedBudgetStore shared = new SharedBudgetStore(usd(10));
        List<BudgetLedger> ledgers = List.of(
                new BudgetLedger(shared, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90),
                new BudgetLedger(shared, BudgetEventListener.NOOP, clock, Duration.ofMinutes(5), 90));
        AtomicInteger next = new AtomicInteger();

        List<Boolean> admitted = runConcurrently(20, () -> ledgers.get(next.getAndIncrement() % 2)
                .reserve(AGENT, usd(1))
                .map(reservation -> true)
                .onErrorResume(BudgetExceededException.class, e -> Mono.just(false))
                .block());

        assertThat(admitted).filteredOn(Boolean::booleanValue).hasSize(10);
        assertThat(shared.heldMicros()).isEqualTo(usd(10));
    }

    @Test
    void negativeEstimateShouldBeRejected() {
        StepVerifier.create(ledger.reserve(AGENT, -1))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void limitUpdateShouldApplyToLoadedAccount() {
        ledger.reserve(AGENT, usd(8)).block();
        ledger.updateLimit(AGENT, usd(20));

        StepVerifier.create(ledger.reserve(AGENT, usd(8)))
                .expectNextCount(1)
                .verifyComplete();
    }

    private boolean reserveQuietly(long micros) {
        return ledger.reserve(AGENT, micros)
                .map(reservation -> true)
                .onErrorResume(BudgetExceededException.class, e -> Mono.just(false))
                .block();
    }

    private static <T> List<T> runConcurrently(int tasks, java.util.concurrent.Callable<T> task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < tasks; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static long usd(long dollars) {
        return dollars * Money.MICROS_PER_USD;
    }

    /**
     * One store behind several ledgers, standing in for Redis.
     */
    private static final class SharedBudgetStore implements BudgetStore {

        private final long limitMicros;
        private final Map<String, Long> holds = new HashMap<>();
        private long spent;

        private SharedBudgetStore(long limitMicros) {
            this.limitMicros = limitMicros;
        }

        @Override
        public synchronized Mono<StoredBudget> getBudget(String agentId) {
            return Mono.just(new StoredBudget(agentId, limitMicros, spent));
        }

        @Override
        public synchronized Mono<StoreAdmission> beginReservation(Reservation reservation, long limitMicros) {
            long available = limitMicros - spent - heldMicros();
            if (reservation.amountMicros() > available) {
                return Mono.just(StoreAdmission.refused(spent, available));
            }
            holds.put(reservation.id(), reservation.amountMicros());
            return Mono.just(StoreAdmission.admitted(spent));
        }

        @Override
        public synchronized Mono<Long> commitReservation(Reservation reservation, long actualMicros) {
            holds.remove(reservation.id());
            spent += actualMicros;
            return Mono.just(spent);
        }

        @Override
        public synchronized Mono<Void> releaseReservation(Reservation reservation) {
            holds.remove(reservation.id());
            return Mono.empty();
        }

        synchronized long heldMicros() {
            return holds.values().stream().mapToLong(Long::longValue).sum();
        }
    }

    private static final class RecordingListener implements BudgetEventListener {

        private final List<BudgetSnapshot> thresholdCrossings = new ArrayList<>();
        private final List<BudgetSnapshot> overruns = new ArrayList<>();
        private final List<Reservation> expired = new ArrayList<>();

        @Override
        public synchronized void onSoftThresholdCrossed(BudgetSnapshot budget, int thresholdPercent) {
            thresholdCrossings.add(budget);
        }

        @Override
        public synchronized void onOverrun(BudgetSnapshot budget, Reservation reservation, long actualMicros) {
            overruns.add(budget);
        }

        @Override
        public synchronized void onReservationExpired(Reservation reservation) {
            expired.add(reservation);
        }
    }
}
