package com.ironcage.gateway.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${gateway.public-url:http://localhost:8080}")
    private String publicUrl;

    @Bean
    public OpenAPI gatewayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Iron Cage LLM Gateway")
                        .version("1.0.0")
                        .description("""
                                Budget-enforced access to LLM providers for autonomous agents.

                                ## Authentication

                                Every agent call carries its gateway token:
                                `Authorization: Bearer <agent-token>`.
                                Provider API keys stay inside the gateway and are never returned.

                                ## Admission

                                - `402 BUDGET_EXCEEDED` - the estimated cost does not fit the remaining budget
                                  (`remainingBudgetUsd` in the body)
                                - `429 RATE_LIMITED` - back off for `Retry-After` seconds
                                - `503 ALL_PROVIDERS_UNAVAILABLE` - every provider for the capability failed
                                  or is short-circuited

                                ## Endpoints

                                - `POST /api/v1/inference` - run an inference call
                                - `GET /api/v1/budget` - budget of the calling agent
                                - `GET /api/v1/providers/health` - circuit breaker state per provider
                                """))
                .servers(List.of(
                        new Server()
                                .url(publicUrl)
                                .description("Gateway")))
                .components(new Components()
                        .addSecuritySchemes("agentToken", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("Agent token issued by the provisioning service")));
    }
}
