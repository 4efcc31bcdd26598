package com.ironcage.gateway.audit;

import com.ironcage.gateway.budget.BudgetEventListener;
import com.ironcage.gateway.budget.BudgetSnapshot;
import com.ironcage.gateway.budget.Reservation;
import com.ironcage.gateway.pricing.Money;

import java.time.Clock;

/**
 * Turns ledger signals into audit events.
 */
public class AuditingBudgetEventListener implements BudgetEventListener {

    private final AuditPublisher publisher;
    private final Clock clock;

    public AuditingBudgetEventListener(AuditPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public void onSoftThresholdCrossed(BudgetSnapshot budget, int thresholdPercent) {
        publisher.publish(AuditEvent.builder(AuditEventType.BUDGET_SOFT_THRESHOLD, clock.instant())
                .agentId(budget.agentId())
                .attribute("thresholdPercent", thresholdPercent)
                .attribute("spentUsd", Money.toUsd(budget.spentMicros()))
                .attribute("limitUsd", Money.toUsd(budget.limitMicros()))
                .build());
    }

    @Override
    public void onOverrun(BudgetSnapshot budget, Reservation reservation, long actualMicros) {
        publisher.publish(AuditEvent.builder(AuditEventType.BUDGET_OVERRUN, clock.instant())
                .agentId(budget.agentId())
                .attribute("reservationId", reservation.id())
                .attribute("reservedUsd", Money.toUsd(reservation.amountMicros()))
                .attribute("actualUsd", Money.toUsd(actualMicros))
                .attribute("spentUsd", Money.toUsd(budget.spentMicros()))
                .attribute("limitUsd", Money.toUsd(budget.limitMicros()))
                .build());
    }

    @Override
    public void onReservationExpired(Reservation reservation) {
        publisher.publish(AuditEvent.builder(AuditEventType.RESERVATION_EXPIRED, clock.instant())
                .agentId(reservation.agentId())
                .attribute("reservationId", reservation.id())
                .attribute("reservedUsd", Money.toUsd(reservation.amountMicros()))
                .build());
    }
}
