package com.ironcage.gateway.budget;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background reconciliation of reservations abandoned by crashed or hung requests.
 */
@Slf4j
@Component
public class ReservationSweeper {

    private final BudgetLedger budgetLedger;

    public ReservationSweeper(BudgetLedger budgetLedger) {
        this.budgetLedger = budgetLedger;
    }

    @Scheduled(fixedDelayString = "#{@budgetConfig.sweepInterval.toMillis()}")
    public void sweep() {
        budgetLedger.sweepExpired()
                .subscribe(
                        released -> {
                            if (released > 0) {
                                log.info("Reservation sweep released {} expired reservations", released);
                            }
                        },
                        error -> log.error("Reservation sweep failed: {}", error.getMessage()));
    }
}
