package com.ironcage.gateway.directory;

import com.ironcage.gateway.config.AgentsConfig;
import com.ironcage.gateway.pricing.Money;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryAgentDirectory implements AgentDirectory {

    private final ConcurrentHashMap<String, AgentRecord> agents = new ConcurrentHashMap<>();

    public static InMemoryAgentDirectory fromConfig(AgentsConfig config) {
        InMemoryAgentDirectory directory = new InMemoryAgentDirectory();
        for (AgentsConfig.Agent agent : config.getAgents()) {
            directory.save(new AgentRecord(agent.getId(), Money.usdToMicros(agent.getBudgetUsd()),
                    new HashSet<>(agent.getProviders()), agent.getTokenId()));
        }
        log.info("Agent directory initialized with {} agents", directory.agents.size());
        return directory;
    }

    @Override
    public Mono<AgentRecord> findAgent(String agentId) {
        return Mono.justOrEmpty(agents.get(agentId));
    }

    @Override
    public void save(AgentRecord agent) {
        agents.put(agent.agentId(), agent);
    }

    @Override
    public void remove(String agentId) {
        agents.remove(agentId);
    }
}
