package com.ironcage.gateway.provider;

import java.util.List;

/**
 * Provider-neutral chat call. Adapters translate it to their native request.
 *
 * @param maxOutputTokens may be null, adapters apply their own default
 * @param temperature     may be null
 */
public record ProviderCall(String providerId,
                           String model,
                           List<ChatMessage> messages,
                           Integer maxOutputTokens,
                           Double temperature,
                           List<String> stop) {

    public ProviderCall {
        messages = List.copyOf(messages);
        stop = stop == null ? List.of() : List.copyOf(stop);
    }
}
