package com.ironcage.gateway.vault;

/**
 * What a request does when the vault cannot produce a credential for a candidate.
 * Neither option ever calls a provider without its own credential.
 */
public enum UnavailablePolicy {
    /** Fail the request with VAULT_UNAVAILABLE. */
    FAIL_CLOSED,
    /** Treat the candidate as unusable and move on to the next one. */
    SKIP_CANDIDATE
}
