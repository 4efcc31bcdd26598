package com.ironcage.gateway.exception;

import lombok.Getter;

import java.util.List;

/**
 * Every fallback candidate for the capability failed or was short-circuited.
 */
@Getter
public class AllProvidersUnavailableException extends GatewayException {

    private final String capability;
    private final List<String> attemptedProviders;

    public AllProvidersUnavailableException(String capability, List<String> attemptedProviders) {
        super(ErrorCode.ALL_PROVIDERS_UNAVAILABLE,
                "No provider available for capability '" + capability + "'");
        this.capability = capability;
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }
}
