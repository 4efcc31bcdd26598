package com.ironcage.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * LLM Gateway Application
 *
 * Sits between autonomous agents and external LLM providers. Handles:
 * - Agent token validation and revocation
 * - Per-agent budget reservation and cost reconciliation
 * - Rate limiting per agent (or agent and capability)
 * - Provider credential translation; agents never see provider keys
 * - Fallback routing with circuit breakers, retries and per-attempt timeouts
 */
@SpringBootApplication
@EnableScheduling
public class LlmGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmGatewayApplication.class, args);
    }
}
