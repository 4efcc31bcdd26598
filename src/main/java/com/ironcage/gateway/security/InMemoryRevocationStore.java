package com.ironcage.gateway.security;

import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRevocationStore implements RevocationStore {

    private final Set<String> revoked = ConcurrentHashMap.newKeySet();

    @Override
    public Mono<Boolean> isRevoked(String tokenId) {
        return Mono.fromSupplier(() -> revoked.contains(tokenId));
    }

    @Override
    public Mono<Void> revoke(String tokenId) {
        return Mono.fromRunnable(() -> revoked.add(tokenId));
    }
}
