package com.ironcage.gateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ironcage.gateway.pricing.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Exception Handler for the LLM Gateway
 *
 * Renders every failure as the same JSON body. Gateway errors carry a stable
 * {@code code} plus the admission hints agents need to back off: the
 * {@code Retry-After} header for rate limiting and the remaining budget for
 * budget refusals.
 */
@Slf4j
@Component
@Order(-1)
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private final ObjectMapper objectMapper;

    public GlobalExceptionHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.error(ex);
        }

        HttpStatus status;
        String code;
        String message;
        Map<String, Object> hints = new LinkedHashMap<>();

        if (ex instanceof GatewayException ge) {
            status = ge.getErrorCode().getStatus();
            code = ge.getErrorCode().name();
            message = ge.getMessage();
            collectHints(exchange, ge, hints);
            log.debug("Gateway error {} on {}: {}", code, exchange.getRequest().getURI().getPath(), message);
        } else if (ex instanceof ResponseStatusException rse) {
            status = HttpStatus.valueOf(rse.getStatusCode().value());
            code = status.name();
            message = rse.getReason();
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            code = "INTERNAL_ERROR";
            message = "An unexpected error occurred";
            log.error("Unhandled exception in gateway", ex);
        }

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", status.getReasonPhrase());
        errorResponse.put("code", code);
        errorResponse.put("message", message);
        errorResponse.put("path", exchange.getRequest().getURI().getPath());
        errorResponse.putAll(hints);

        try {
            byte[] bytes = objectMapper.writeValueAsBytes(errorResponse);
            DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing error response", e);
            return exchange.getResponse().setComplete();
        }
    }

    private void collectHints(ServerWebExchange exchange, GatewayException ex, Map<String, Object> hints) {
        if (ex instanceof RateLimitedException rle) {
            long seconds = Math.max(1, (rle.getRetryAfter().toMillis() + 999) / 1000);
            exchange.getResponse().getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
            hints.put("retryAfterSeconds", seconds);
        } else if (ex instanceof BudgetExceededException bee) {
            hints.put("remainingBudgetUsd", Money.toUsd(bee.getRemainingMicros()));
            hints.put("requestedUsd", Money.toUsd(bee.getRequestedMicros()));
        } else if (ex instanceof AllProvidersUnavailableException ape) {
            hints.put("capability", ape.getCapability());
            hints.put("attemptedProviders", ape.getAttemptedProviders());
        }
    }
}
