package com.ironcage.gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Agents provisioned at startup. The management service owns agents of record;
 * this seeds the local directory for development and single-node deployments.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class AgentsConfig {

    private List<Agent> agents = new ArrayList<>();

    @Getter
    @Setter
    public static class Agent {
        private String id;
        private BigDecimal budgetUsd = BigDecimal.ZERO;
        private List<String> providers = new ArrayList<>();
        private String tokenId;
    }
}
