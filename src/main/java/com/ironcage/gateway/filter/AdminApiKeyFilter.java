package com.ironcage.gateway.filter;

import com.ironcage.gateway.config.AuthConfig;
import com.ironcage.gateway.exception.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Admin API Key Filter
 *
 * Guards the provisioning endpoints under {@code /api/v1/admin}. The provisioning
 * service authenticates with {@code X-Admin-Api-Key}; agent tokens are not accepted here.
 *
 * Flow:
 * 1. Not an admin path: pass through
 * 2. No admin key configured: reject, the admin interface is disabled
 * 3. Header missing or different: reject as UNAUTHENTICATED
 */
@Slf4j
@Component
public class AdminApiKeyFilter implements WebFilter, Ordered {

    public static final String ADMIN_API_KEY_HEADER = "X-Admin-Api-Key";
    static final String ADMIN_PATH_PREFIX = "/api/v1/admin/";

    private final AuthConfig config;

    public AdminApiKeyFilter(AuthConfig config) {
        this.config = config;

        if (config.getAdminApiKey() == null || config.getAdminApiKey().isEmpty()) {
            log.info("AdminApiKeyFilter: no admin API key configured, admin endpoints disabled");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getURI().getPath();
        if (!path.startsWith(ADMIN_PATH_PREFIX)) {
            return chain.filter(exchange);
        }

        String expected = config.getAdminApiKey();
        if (expected == null || expected.isEmpty()) {
            return Mono.error(new UnauthenticatedException("Admin interface is disabled"));
        }

        String provided = exchange.getRequest().getHeaders().getFirst(ADMIN_API_KEY_HEADER);
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid admin API key for request to: {}", path);
            return Mono.error(new UnauthenticatedException("Invalid admin API key"));
        }

        return chain.filter(exchange);
    }

    @Override
    public int getOrder() {
        // After LoggingFilter so rejected calls are still logged
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }
}
