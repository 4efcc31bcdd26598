package com.ironcage.gateway.security;

import com.ironcage.gateway.directory.AgentDirectory;
import com.ironcage.gateway.directory.AgentRecord;
import com.ironcage.gateway.exception.InvalidRequestException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Mints agent tokens on behalf of the provisioning collaborator.
 *
 * An agent has exactly one valid token: issuing a new one records its id as the agent's
 * current token and revokes the previous id, so the old token stops working immediately.
 */
@Slf4j
public class TokenIssuer {

    private final SecretKey signingKey;
    private final AgentDirectory directory;
    private final RevocationStore revocationStore;
    private final Duration tokenTtl;
    private final Clock clock;

    public TokenIssuer(String jwtSecret,
                       AgentDirectory directory,
                       RevocationStore revocationStore,
                       Duration tokenTtl,
                       Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.directory = directory;
        this.revocationStore = revocationStore;
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    public Mono<IssuedToken> issue(String agentId) {
        return issue(agentId, List.of());
    }

    public Mono<IssuedToken> issue(String agentId, List<String> scopes) {
        return directory.findAgent(agentId)
                .switchIfEmpty(Mono.error(new InvalidRequestException("Unknown agent " + agentId)))
                .flatMap(agent -> {
                    String tokenId = UUID.randomUUID().toString();
                    String token = sign(agentId, tokenId, scopes);
                    directory.save(agent.withTokenId(tokenId));
                    log.info("Issued token {} for agent {}", tokenId, agentId);
                    return revokePrevious(agent)
                            .thenReturn(new IssuedToken(agentId, tokenId, token));
                });
    }

    /**
     * Regenerates the agent's token. Same as {@link #issue(String)}; named for call sites
     * where invalidating the old token is the point.
     */
    public Mono<IssuedToken> rotate(String agentId) {
        return issue(agentId);
    }

    public Mono<Void> revoke(String tokenId) {
        return revocationStore.revoke(tokenId);
    }

    private Mono<Void> revokePrevious(AgentRecord agent) {
        if (agent.currentTokenId() == null) {
            return Mono.empty();
        }
        return revocationStore.revoke(agent.currentTokenId());
    }

    private String sign(String agentId, String tokenId, List<String> scopes) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .subject(agentId)
                .id(tokenId)
                .issuedAt(Date.from(now));
        if (!scopes.isEmpty()) {
            builder.claim(TokenValidator.SCOPE_CLAIM, scopes);
        }
        if (!tokenTtl.isZero() && !tokenTtl.isNegative()) {
            builder.expiration(Date.from(now.plus(tokenTtl)));
        }
        return builder.signWith(signingKey).compact();
    }
}
