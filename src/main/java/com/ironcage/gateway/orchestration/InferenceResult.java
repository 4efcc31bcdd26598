package com.ironcage.gateway.orchestration;

import java.math.BigDecimal;

/**
 * Successful inference: the provider's answer plus the actual cost charged and what is
 * left of the agent's budget afterwards.
 */
public record InferenceResult(String requestId,
                              String provider,
                              String model,
                              String content,
                              long inputTokens,
                              long outputTokens,
                              BigDecimal costUsd,
                              BigDecimal remainingBudgetUsd) {
}
