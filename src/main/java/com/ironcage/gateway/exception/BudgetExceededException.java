package com.ironcage.gateway.exception;

import lombok.Getter;

/**
 * Admission refused because the estimate does not fit in the agent's remaining budget.
 */
@Getter
public class BudgetExceededException extends GatewayException {

    private final String agentId;
    private final long requestedMicros;
    private final long remainingMicros;

    public BudgetExceededException(String agentId, long requestedMicros, long remainingMicros) {
        super(ErrorCode.BUDGET_EXCEEDED, String.format(
                "Budget exceeded for agent %s: requested %d micros, remaining %d micros",
                agentId, requestedMicros, remainingMicros));
        this.agentId = agentId;
        this.requestedMicros = requestedMicros;
        this.remainingMicros = remainingMicros;
    }
}
