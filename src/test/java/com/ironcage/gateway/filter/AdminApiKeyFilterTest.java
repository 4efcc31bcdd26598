package com.ironcage.gateway.filter;

import com.ironcage.gateway.config.AuthConfig;
import com.ironcage.gateway.exception.UnauthenticatedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class AdminApiKeyFilterTest {

    private AuthConfig config;
    private AtomicBoolean passed;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        config = new AuthConfig();
        config.setAdminApiKey("admin-key");
        passed = new AtomicBoolean();
        chain = exchange -> {
            passed.set(true);
            return Mono.empty();
        };
    }

    @Test
    void nonAdminPathShouldPassWithoutKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/inference"));

        StepVerifier.create(new AdminApiKeyFilter(config).filter(exchange, chain)).verifyComplete();

        assertThat(passed).isTrue();
    }

    @Test
    void matchingKeyShouldPass() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .post("/api/v1/admin/agents/agent-1/tokens")
                .header(AdminApiKeyFilter.ADMIN_API_KEY_HEADER, "admin-key"));

        StepVerifier.create(new AdminApiKeyFilter(config).filter(exchange, chain)).verifyComplete();

        assertThat(passed).isTrue();
    }

    @Test
    void wrongOrMissingKeyShouldBeRejected() {
        MockServerWebExchange wrong = MockServerWebExchange.from(MockServerHttpRequest
                .delete("/api/v1/admin/tokens/t1")
                .header(AdminApiKeyFilter.ADMIN_API_KEY_HEADER, "guess"));
        MockServerWebExchange missing = MockServerWebExchange.from(MockServerHttpRequest
                .delete("/api/v1/admin/tokens/t1"));

        StepVerifier.create(new AdminApiKeyFilter(config).filter(wrong, chain))
                .expectError(UnauthenticatedException.class)
                .verify();
        StepVerifier.create(new AdminApiKeyFilter(config).filter(missing, chain))
                .expectError(UnauthenticatedException.class)
                .verify();

        assertThat(passed).isFalse();
    }

    @Test
    void unconfiguredKeyShouldDisableAdminPaths() {
        config.setAdminApiKey("");
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .post("/api/v1/admin/agents/agent-1/tokens")
                .header(AdminApiKeyFilter.ADMIN_API_KEY_HEADER, ""));

        StepVerifier.create(new AdminApiKeyFilter(config).filter(exchange, chain))
                .expectErrorMessage("Admin interface is disabled")
                .verify();

        assertThat(passed).isFalse();
    }
}
