package com.ironcage.gateway.budget;

import com.ironcage.gateway.directory.AgentDirectory;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node ledger persistence. Limits come from the agent directory, committed spend
 * lives in process memory and is lost on restart. Admission is left entirely to the ledger.
 */
public class InMemoryBudgetStore implements BudgetStore {

    private final AgentDirectory agentDirectory;
    private final ConcurrentHashMap<String, Long> spent = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Reservation> reservations = new ConcurrentHashMap<>();

    public InMemoryBudgetStore(AgentDirectory agentDirectory) {
        this.agentDirectory = agentDirectory;
    }

    @Override
    public Mono<StoredBudget> getBudget(String agentId) {
        return agentDirectory.findAgent(agentId)
                .map(agent -> new StoredBudget(agentId, agent.limitMicros(), spent.getOrDefault(agentId, 0L)));
    }

    @Override
    public Mono<StoreAdmission> beginReservation(Reservation reservation, long limitMicros) {
        return Mono.fromSupplier(() -> {
            reservations.put(reservation.id(), reservation);
            return StoreAdmission.admitted(spentMicros(reservation.agentId()));
        });
    }

    @Override
    public Mono<Long> commitReservation(Reservation reservation, long actualMicros) {
        return Mono.fromSupplier(() -> {
            reservations.remove(reservation.id());
            return spent.merge(reservation.agentId(), actualMicros, Long::sum);
        });
    }

    @Override
    public Mono<Void> releaseReservation(Reservation reservation) {
        return Mono.fromRunnable(() -> reservations.remove(reservation.id()));
    }

    long spentMicros(String agentId) {
        return spent.getOrDefault(agentId, 0L);
    }

    int openReservations() {
        return reservations.size();
    }
}
