package com.ironcage.gateway.provider;

/**
 * Normalized provider answer with the usage the actual cost is computed from.
 */
public record ProviderResponse(String model, String content, long inputTokens, long outputTokens) {
}
