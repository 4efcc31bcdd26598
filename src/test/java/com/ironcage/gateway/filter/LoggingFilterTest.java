package com.ironcage.gateway.filter;

import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingFilterTest {

    private final LoggingFilter filter = new LoggingFilter();

    @Test
    void providedCorrelationIdShouldBeEchoed() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .get("/api/v1/budget")
                .header(LoggingFilter.CORRELATION_ID_HEADER, "corr-42"));
        AtomicReference<String> seenDownstream = new AtomicReference<>();

        StepVerifier.create(filter.filter(exchange, mutated -> {
                    seenDownstream.set(mutated.getRequest().getHeaders().getFirst(LoggingFilter.CORRELATION_ID_HEADER));
                    return Mono.empty();
                }))
                .verifyComplete();

        assertThat(seenDownstream.get()).isEqualTo("corr-42");
        assertThat(exchange.getResponse().getHeaders().getFirst(LoggingFilter.CORRELATION_ID_HEADER)).isEqualTo("corr-42");
    }

    @Test
    void missingCorrelationIdShouldBeGenerated() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/budget"));
        AtomicReference<String> seenDownstream = new AtomicReference<>();

        StepVerifier.create(filter.filter(exchange, mutated -> {
                    seenDownstream.set(mutated.getRequest().getHeaders().getFirst(LoggingFilter.CORRELATION_ID_HEADER));
                    return Mono.empty();
                }))
                .verifyComplete();

        assertThat(seenDownstream.get()).isNotBlank();
        assertThat(exchange.getResponse().getHeaders().getFirst(LoggingFilter.CORRELATION_ID_HEADER))
                .isEqualTo(seenDownstream.get());
    }

    @Test
    void unsafeCorrelationIdShouldBeReplaced() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .get("/api/v1/budget")
                .header(LoggingFilter.CORRELATION_ID_HEADER, "abc forged log line"));

        StepVerifier.create(filter.filter(exchange, mutated -> Mono.empty())).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(LoggingFilter.CORRELATION_ID_HEADER))
                .isNotBlank()
                .doesNotContain("forged");
    }
}
