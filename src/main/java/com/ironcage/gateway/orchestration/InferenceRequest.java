package com.ironcage.gateway.orchestration;

import com.ironcage.gateway.provider.ChatMessage;

import java.util.List;

/**
 * Agent inference request.
 *
 * @param capability      logical capability, resolved to providers by the fallback tiers
 * @param maxOutputTokens optional output cap, bounded by each model's own cap
 * @param temperature     optional sampling temperature, passed through
 * @param stop            optional stop strings
 */
public record InferenceRequest(String capability,
                               List<ChatMessage> messages,
                               Integer maxOutputTokens,
                               Double temperature,
                               List<String> stop) {

    public InferenceRequest(String capability, List<ChatMessage> messages) {
        this(capability, messages, null, null, null);
    }
}
