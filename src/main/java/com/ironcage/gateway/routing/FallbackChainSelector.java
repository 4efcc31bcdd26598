package com.ironcage.gateway.routing;

import com.ironcage.gateway.resilience.CircuitBreakerRegistry;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the ordered candidate list for a capability.
 *
 * Candidates whose breaker is OPEN and candidates already attempted in this request
 * are dropped; the rest are ordered by the configured preference. Ties keep
 * configuration order. An empty result means the capability cannot be served right now.
 */
public class FallbackChainSelector {

    private final Map<String, List<FallbackTier>> tiersByCapability;
    private final CircuitBreakerRegistry breakers;
    private final RoutingPreference preference;

    public FallbackChainSelector(List<FallbackTier> tiers,
                                 CircuitBreakerRegistry breakers,
                                 RoutingPreference preference) {
        this.tiersByCapability = tiers.stream()
                .collect(Collectors.groupingBy(FallbackTier::capability, Collectors.toUnmodifiableList()));
        this.breakers = breakers;
        this.preference = preference;
    }

    public List<FallbackTier> select(String capability) {
        return select(capability, Set.of());
    }

    public List<FallbackTier> select(String capability, Collection<String> excludeProviders) {
        Comparator<FallbackTier> order = Comparator.comparingInt(FallbackTier::weight);
        if (preference == RoutingPreference.QUALITY) {
            order = order.reversed();
        }
        return configuredTiers(capability).stream()
                .filter(tier -> !excludeProviders.contains(tier.providerId()))
                .filter(tier -> !breakers.isOpen(tier.providerId()))
                .sorted(order)
                .toList();
    }

    /**
     * Every tier configured for the capability, regardless of breaker state.
     */
    public List<FallbackTier> configuredTiers(String capability) {
        return tiersByCapability.getOrDefault(capability, List.of());
    }

    public boolean supports(String capability) {
        return tiersByCapability.containsKey(capability);
    }
}
