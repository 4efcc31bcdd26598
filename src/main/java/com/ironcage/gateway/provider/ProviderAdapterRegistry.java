package com.ironcage.gateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ironcage.gateway.config.RoutingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider id to adapter lookup, one adapter per configured provider.
 */
@Slf4j
public class ProviderAdapterRegistry {

    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();

    public static ProviderAdapterRegistry fromConfig(RoutingConfig config,
                                                     WebClient.Builder webClientBuilder,
                                                     ObjectMapper objectMapper) {
        ProviderAdapterRegistry registry = new ProviderAdapterRegistry();
        config.getProviders().forEach((providerId, provider) -> {
            WebClient webClient = webClientBuilder.clone().baseUrl(provider.getBaseUrl()).build();
            ProviderAdapter adapter = switch (provider.getType()) {
                case OPENAI -> new OpenAiCompatibleAdapter(providerId, webClient, objectMapper);
                case ANTHROPIC -> new AnthropicAdapter(providerId, webClient, objectMapper);
            };
            registry.register(providerId, adapter);
            log.info("Provider {} registered ({} at {})", providerId, provider.getType(), provider.getBaseUrl());
        });
        return registry;
    }

    public void register(String providerId, ProviderAdapter adapter) {
        adapters.put(providerId, adapter);
    }

    public Optional<ProviderAdapter> adapterFor(String providerId) {
        return Optional.ofNullable(adapters.get(providerId));
    }

    public Set<String> providerIds() {
        return new TreeSet<>(adapters.keySet());
    }
}
