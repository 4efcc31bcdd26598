package com.ironcage.gateway.security;

import reactor.core.publisher.Mono;

/**
 * Authoritative record of revoked token ids.
 */
public interface RevocationStore {

    Mono<Boolean> isRevoked(String tokenId);

    Mono<Void> revoke(String tokenId);
}
