package com.ironcage.gateway.provider;

/**
 * Wire protocols the gateway can speak to a provider.
 */
public enum ProviderType {
    /**
     * OpenAI compatible {@code /chat/completions}.
     */
    OPENAI,
    /**
     * Anthropic {@code /messages}.
     */
    ANTHROPIC
}
