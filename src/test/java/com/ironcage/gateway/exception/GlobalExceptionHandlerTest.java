package com.ironcage.gateway.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(objectMapper);

    private MockServerWebExchange exchange() {
        return MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/inference"));
    }

    private JsonNode body(MockServerWebExchange exchange) throws Exception {
        return objectMapper.readTree(exchange.getResponse().getBodyAsString().block());
    }

    @Test
    void rateLimitShouldSetRetryAfterHeaderInWholeSeconds() throws Exception {
        MockServerWebExchange exchange = exchange();

        handler.handle(exchange, new RateLimitedException("agent-1", Duration.ofMillis(1500))).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(exchange.getResponse().getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("2");
        JsonNode body = body(exchange);
        assertThat(body.path("code").asText()).isEqualTo("RATE_LIMITED");
        assertThat(body.path("retryAfterSeconds").asLong()).isEqualTo(2);
        assertThat(body.path("path").asText()).isEqualTo("/api/v1/inference");
    }

    @Test
    void budgetRefusalShouldReportRemainingBudget() throws Exception {
        MockServerWebExchange exchange = exchange();

        handler.handle(exchange, new BudgetExceededException("agent-1", 2_000_000, 500_000)).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        assertThat(exchange.getResponse().getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        JsonNode body = body(exchange);
        assertThat(body.path("status").asInt()).isEqualTo(402);
        assertThat(body.path("code").asText()).isEqualTo("BUDGET_EXCEEDED");
        assertThat(body.path("remainingBudgetUsd").decimalValue()).isEqualByComparingTo("0.5");
        assertThat(body.path("requestedUsd").decimalValue()).isEqualByComparingTo("2");
    }

    @Test
    void exhaustionShouldListAttemptedProviders() throws Exception {
        MockServerWebExchange exchange = exchange();

        handler.handle(exchange, new AllProvidersUnavailableException("chat", List.of("openai", "anthropic"))).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        JsonNode body = body(exchange);
        assertThat(body.path("code").asText()).isEqualTo("ALL_PROVIDERS_UNAVAILABLE");
        assertThat(body.path("attemptedProviders")).hasSize(2);
    }

    @Test
    void revokedTokenShouldBeUnauthorizedWithOwnCode() throws Exception {
        MockServerWebExchange exchange = exchange();

        handler.handle(exchange, new RevokedTokenException("Token has been revoked")).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(body(exchange).path("code").asText()).isEqualTo("REVOKED");
    }

    @Test
    void responseStatusExceptionShouldKeepItsStatus() throws Exception {
        MockServerWebExchange exchange = exchange();

        handler.handle(exchange, new ResponseStatusException(HttpStatus.NOT_FOUND, "No route")).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(body(exchange).path("message").asText()).isEqualTo("No route");
    }

    @Test
    void unexpectedErrorShouldNotLeakDetails() throws Exception {
        MockServerWebExchange exchange = exchange();

        handler.handle(exchange, new IllegalStateException("sk-live-secret in stack")).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        JsonNode body = body(exchange);
        assertThat(body.path("code").asText()).isEqualTo("INTERNAL_ERROR");
        assertThat(body.toString()).doesNotContain("sk-live-secret");
    }
}
