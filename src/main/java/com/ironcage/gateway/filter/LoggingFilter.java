package com.ironcage.gateway.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Logging Filter
 *
 * Request/response logging with correlation ids. The id is taken from
 * {@code X-Correlation-Id} when the agent sends a usable one, otherwise generated, and is
 * echoed on the response. The inference endpoint uses it as the request id, so audit
 * events and access logs share one key.
 *
 * Only method, path, status and timing are logged. Headers never are: they carry agent
 * tokens and admin keys.
 */
@Slf4j
@Component
public class LoggingFilter implements WebFilter, Ordered {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long startNanos = System.nanoTime();
        ServerHttpRequest request = exchange.getRequest();
        String correlationId = correlationId(request);

        ServerHttpRequest tagged = request.mutate()
                .headers(headers -> headers.set(CORRELATION_ID_HEADER, correlationId))
                .build();
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        log.info("--> {} {} [{}] from {}", request.getMethod(), request.getURI().getPath(),
                correlationId, clientAddress(request));

        return chain.filter(exchange.mutate().request(tagged).build())
                .doFinally(signal -> log.info("<-- {} {} [{}] {} in {}ms",
                        request.getMethod(),
                        request.getURI().getPath(),
                        correlationId,
                        exchange.getResponse().getStatusCode(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)));
    }

    // Agent-supplied ids end up in logs and audit records, so anything odd is replaced.
    private static String correlationId(ServerHttpRequest request) {
        String provided = request.getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (provided != null && SAFE_CORRELATION_ID.matcher(provided).matches()) {
            return provided;
        }
        return UUID.randomUUID().toString();
    }

    private static String clientAddress(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddress() != null ? request.getRemoteAddress().toString() : "unknown";
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }
}
