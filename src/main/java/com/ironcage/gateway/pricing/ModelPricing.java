package com.ironcage.gateway.pricing;

/**
 * Per-model prices in USD per million tokens.
 *
 * Multiplying a USD-per-million price by a token count yields micro-dollars directly,
 * which is why the ledger never touches floating point amounts.
 */
public record ModelPricing(String model,
                           double inputUsdPerMillion,
                           double outputUsdPerMillion,
                           int maxOutputTokens) {

    public boolean hasValidPricing() {
        return inputUsdPerMillion > 0 || outputUsdPerMillion > 0;
    }

    public long costMicros(long inputTokens, long outputTokens) {
        double micros = inputTokens * inputUsdPerMillion + outputTokens * outputUsdPerMillion;
        return (long) Math.ceil(micros);
    }

    /**
     * Worst-case cost: the requested output cap, bounded by the model's own cap.
     */
    public long maxCostMicros(long inputTokens, Integer requestedMaxOutput) {
        int outputLimit = requestedMaxOutput == null
                ? maxOutputTokens
                : Math.min(requestedMaxOutput, maxOutputTokens);
        return costMicros(inputTokens, outputLimit);
    }
}
