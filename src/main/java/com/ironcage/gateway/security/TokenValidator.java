package com.ironcage.gateway.security;

/*
 * ============================================================================
 * TOKEN VALIDATOR - CODE FLOW
 * ============================================================================
 *
 *   AGENT TOKEN
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Verify JWT signature + expiry    │ → fails: UNAUTHENTICATED
 *   │    - sub (agent id) and jti present │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Revocation store: jti revoked?   │ → yes: REVOKED
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Agent directory                  │
 *   │    - agent still provisioned?       │ → no: REVOKED
 *   │    - jti is the current token?      │ → rotated: REVOKED
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   AgentIdentity
 *
 * ============================================================================
 */

import com.ironcage.gateway.directory.AgentDirectory;
import com.ironcage.gateway.exception.RevokedTokenException;
import com.ironcage.gateway.exception.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies agent tokens and resolves them to an {@link AgentIdentity}.
 * Has no side effects apart from warming the revocation cache.
 */
@Slf4j
public class TokenValidator {

    static final String SCOPE_CLAIM = "scope";

    private final SecretKey signingKey;
    private final RevocationStore revocationStore;
    private final AgentDirectory directory;
    private final boolean revocationFailOpen;

    public TokenValidator(String jwtSecret,
                          RevocationStore revocationStore,
                          AgentDirectory directory,
                          boolean revocationFailOpen) {
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.revocationStore = revocationStore;
        this.directory = directory;
        this.revocationFailOpen = revocationFailOpen;
    }

    public Mono<AgentIdentity> validate(String token) {
        if (token == null || token.isBlank()) {
            return Mono.error(new UnauthenticatedException("Missing agent token"));
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.warn("Expired token presented for agent {}", e.getClaims().getSubject());
            return Mono.error(new UnauthenticatedException("Token has expired"));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Token validation failed: {}", e.getMessage());
            return Mono.error(new UnauthenticatedException("Invalid token"));
        }

        String agentId = claims.getSubject();
        String tokenId = claims.getId();
        if (agentId == null || tokenId == null) {
            return Mono.error(new UnauthenticatedException("Token is missing required claims"));
        }
        AgentIdentity identity = new AgentIdentity(agentId, tokenId, scopes(claims));

        return checkRevocation(tokenId)
                .flatMap(revoked -> {
                    if (revoked) {
                        return Mono.error(new RevokedTokenException("Token has been revoked"));
                    }
                    return directory.findAgent(agentId)
                            .switchIfEmpty(Mono.error(new RevokedTokenException("Agent is no longer provisioned")))
                            .flatMap(agent -> tokenId.equals(agent.currentTokenId())
                                    ? Mono.just(identity)
                                    : Mono.error(new RevokedTokenException("Token has been rotated")));
                });
    }

    private Mono<Boolean> checkRevocation(String tokenId) {
        return revocationStore.isRevoked(tokenId)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.error("Revocation check failed for token {}: {}", tokenId, e.getMessage());
                    if (revocationFailOpen) {
                        return Mono.just(false);
                    }
                    return Mono.error(new UnauthenticatedException("Token revocation status unavailable", e));
                });
    }

    private List<String> scopes(Claims claims) {
        Object raw = claims.get(SCOPE_CLAIM);
        List<String> scopes = new ArrayList<>();
        if (raw instanceof List<?> list) {
            list.forEach(item -> scopes.add(String.valueOf(item)));
        } else if (raw instanceof String single && !single.isBlank()) {
            scopes.add(single);
        }
        return scopes;
    }
}
