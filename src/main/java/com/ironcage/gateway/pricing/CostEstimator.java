package com.ironcage.gateway.pricing;

import com.ironcage.gateway.provider.ChatMessage;
import com.ironcage.gateway.routing.FallbackTier;

import java.util.List;

/**
 * Pre-flight cost estimates and post-flight actual costs.
 *
 * Input size is approximated at four characters per token plus a fixed per-message
 * overhead. The estimate for a capability is the worst case over every configured tier,
 * so whichever fallback ends up serving the request was covered by the reservation.
 */
public class CostEstimator {

    static final int CHARS_PER_TOKEN = 4;
    static final int TOKENS_PER_MESSAGE = 4;

    private final PricingCatalog catalog;

    public CostEstimator(PricingCatalog catalog) {
        this.catalog = catalog;
    }

    public long estimateInputTokens(List<ChatMessage> messages) {
        long tokens = 0;
        for (ChatMessage message : messages) {
            int chars = message.content() == null ? 0 : message.content().length();
            tokens += (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN + TOKENS_PER_MESSAGE;
        }
        return tokens;
    }

    public long estimateMicros(List<FallbackTier> tiers, List<ChatMessage> messages, Integer maxOutputTokens) {
        long inputTokens = estimateInputTokens(messages);
        long worst = 0;
        for (FallbackTier tier : tiers) {
            worst = Math.max(worst, catalog.pricingFor(tier.model()).maxCostMicros(inputTokens, maxOutputTokens));
        }
        return worst;
    }

    /**
     * Output cap sent to the provider: the requested cap bounded by the model's own.
     */
    public int outputCap(String model, Integer requestedMaxOutput) {
        int modelCap = catalog.pricingFor(model).maxOutputTokens();
        return requestedMaxOutput == null ? modelCap : Math.min(requestedMaxOutput, modelCap);
    }

    public long actualMicros(String model, long inputTokens, long outputTokens) {
        return catalog.pricingFor(model).costMicros(inputTokens, outputTokens);
    }
}
