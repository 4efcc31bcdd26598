package com.ironcage.gateway.config;

import com.ironcage.gateway.provider.ProviderType;
import com.ironcage.gateway.routing.FallbackTier;
import com.ironcage.gateway.routing.RoutingPreference;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider endpoints and the fallback tiers that map capabilities onto them.
 *
 * <pre>
 * gateway:
 *   routing:
 *     preference: QUALITY
 *     providers:
 *       openai:    { type: OPENAI,    base-url: https://api.openai.com/v1 }
 *       anthropic: { type: ANTHROPIC, base-url: https://api.anthropic.com/v1 }
 *     tiers:
 *       chat-large:
 *         - { provider: openai,    model: gpt-4o,            weight: 100 }
 *         - { provider: anthropic, model: claude-sonnet-4-5, weight: 90 }
 * </pre>
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.routing")
public class RoutingConfig {

    private RoutingPreference preference = RoutingPreference.QUALITY;

    private Map<String, Provider> providers = new LinkedHashMap<>();

    private Map<String, List<Tier>> tiers = new LinkedHashMap<>();

    public List<FallbackTier> fallbackTiers() {
        List<FallbackTier> result = new ArrayList<>();
        tiers.forEach((capability, entries) -> entries.forEach(entry ->
                result.add(new FallbackTier(capability, entry.provider, entry.model, entry.weight))));
        return result;
    }

    @Getter
    @Setter
    public static class Provider {
        private ProviderType type = ProviderType.OPENAI;
        private String baseUrl;
    }

    @Getter
    @Setter
    public static class Tier {
        private String provider;
        private String model;
        private int weight = 0;
    }
}
