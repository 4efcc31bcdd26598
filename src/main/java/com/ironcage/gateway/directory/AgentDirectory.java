package com.ironcage.gateway.directory;

import reactor.core.publisher.Mono;

/**
 * Policy/provisioning store: which agents exist, their budget ceiling, their
 * provider bindings and their current token.
 */
public interface AgentDirectory {

    Mono<AgentRecord> findAgent(String agentId);

    void save(AgentRecord agent);

    void remove(String agentId);
}
