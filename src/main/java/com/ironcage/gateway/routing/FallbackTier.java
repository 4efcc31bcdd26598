package com.ironcage.gateway.routing;

/**
 * One candidate for a capability: a provider, the model to ask it for, and a preference weight.
 * Weight reads as quality under {@link RoutingPreference#QUALITY} and as cost under
 * {@link RoutingPreference#COST}.
 */
public record FallbackTier(String capability, String providerId, String model, int weight) {
}
