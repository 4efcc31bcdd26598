package com.ironcage.gateway.vault;

import java.util.Objects;

/**
 * Decrypted provider secret, handed to a provider adapter for a single outbound call.
 * Never logged and never returned to an agent: {@link #toString()} is redacted.
 */
public final class ProviderCredential {

    private final String providerId;
    private final String secret;

    public ProviderCredential(String providerId, String secret) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.secret = Objects.requireNonNull(secret, "secret");
    }

    public String providerId() {
        return providerId;
    }

    public String secret() {
        return secret;
    }

    @Override
    public String toString() {
        return "ProviderCredential[providerId=" + providerId + ", secret=<redacted>]";
    }
}
