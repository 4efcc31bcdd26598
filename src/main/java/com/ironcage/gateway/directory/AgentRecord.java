package com.ironcage.gateway.directory;

import java.util.Set;

/**
 * Provisioned agent as known to the gateway.
 *
 * @param agentId          agent identity
 * @param limitMicros      budget ceiling in micro-dollars
 * @param providerBindings provider ids the agent may be routed to
 * @param currentTokenId   id of the only token currently valid for the agent, or null before issuance
 */
public record AgentRecord(String agentId, long limitMicros, Set<String> providerBindings, String currentTokenId) {

    public AgentRecord {
        providerBindings = Set.copyOf(providerBindings);
    }

    public boolean isBoundTo(String providerId) {
        return providerBindings.contains(providerId);
    }

    public AgentRecord withTokenId(String tokenId) {
        return new AgentRecord(agentId, limitMicros, providerBindings, tokenId);
    }
}
