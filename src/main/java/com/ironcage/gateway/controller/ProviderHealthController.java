package com.ironcage.gateway.controller;

import com.ironcage.gateway.provider.ProviderAdapterRegistry;
import com.ironcage.gateway.resilience.BreakerSnapshot;
import com.ironcage.gateway.resilience.CircuitBreakerRegistry;
import com.ironcage.gateway.resilience.CircuitState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Read-only breaker view per provider, for operators and dashboards.
 */
@RestController
@RequestMapping("/api/v1/providers")
@Tag(name = "Providers", description = "Provider circuit breaker state")
public class ProviderHealthController {

    private final CircuitBreakerRegistry circuitBreakers;
    private final ProviderAdapterRegistry providerAdapters;

    public ProviderHealthController(CircuitBreakerRegistry circuitBreakers, ProviderAdapterRegistry providerAdapters) {
        this.circuitBreakers = circuitBreakers;
        this.providerAdapters = providerAdapters;
    }

    @GetMapping("/health")
    @Operation(summary = "Circuit breaker state of every provider")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, BreakerSnapshot> snapshots = circuitBreakers.snapshots();
        TreeSet<String> providerIds = new TreeSet<>(providerAdapters.providerIds());
        providerIds.addAll(snapshots.keySet());

        List<Map<String, Object>> providers = new ArrayList<>();
        for (String providerId : providerIds) {
            BreakerSnapshot snapshot = snapshots.get(providerId);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("provider", providerId);
            entry.put("state", snapshot != null ? snapshot.state() : CircuitState.CLOSED);
            entry.put("failures", snapshot != null ? snapshot.failures() : 0);
            providers.add(entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now().toString());
        body.put("providers", providers);
        return Mono.just(ResponseEntity.ok(body));
    }
}
