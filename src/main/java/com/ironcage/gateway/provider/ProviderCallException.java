package com.ironcage.gateway.provider;

import lombok.Getter;

/**
 * A provider call failed. Never reaches the agent: the orchestrator retries it,
 * feeds it to the provider's breaker and finally folds it into
 * {@link com.ironcage.gateway.exception.AllProvidersUnavailableException}.
 */
@Getter
public class ProviderCallException extends RuntimeException {

    /**
     * Transport failure, no HTTP status was received.
     */
    public static final int NO_STATUS = 0;

    private final String providerId;
    private final int statusCode;

    public ProviderCallException(String providerId, int statusCode, String message) {
        super(message);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public ProviderCallException(String providerId, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    /**
     * Whether the failure says something about the provider's health. Client errors other
     * than timeout and throttling are the request's fault: they are neither retried nor
     * counted by the breaker.
     */
    public boolean isDependencyFault() {
        return statusCode == NO_STATUS
                || statusCode == 408
                || statusCode == 429
                || statusCode >= 500;
    }

    /**
     * Whether an error from a provider call should be recorded as a breaker failure.
     * Anything that is not a provider response, such as a timeout, counts.
     */
    public static boolean countsAgainstProvider(Throwable error) {
        return !(error instanceof ProviderCallException pce) || pce.isDependencyFault();
    }
}
