package com.ironcage.gateway.security;

import java.util.List;

/**
 * Identity resolved from a valid agent token.
 *
 * @param agentId agent the token was minted for
 * @param tokenId token id ({@code jti}), the unit of revocation
 * @param scopes  scopes carried by the token; empty means unrestricted
 */
public record AgentIdentity(String agentId, String tokenId, List<String> scopes) {

    public AgentIdentity {
        scopes = List.copyOf(scopes);
    }
}
