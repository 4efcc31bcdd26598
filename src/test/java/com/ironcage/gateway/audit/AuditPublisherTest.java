package com.ironcage.gateway.audit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditPublisherTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final List<List<AuditEvent>> batches = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    private static AuditEvent event(String requestId) {
        return AuditEvent.builder(AuditEventType.REQUEST_COMPLETED, NOW)
                .requestId(requestId)
                .agentId("agent-1")
                .attribute("provider", "openai")
                .attribute("model", null)
                .build();
    }

    @Test
    void publishShouldOnlyEnqueue() {
        AuditPublisher publisher = new AuditPublisher(batches::add, 10, 5, Duration.ofSeconds(1), meterRegistry);

        publisher.publish(event("r1"));

        assertThat(batches).isEmpty();
        assertThat(publisher.pending()).isEqualTo(1);
        assertThat(meterRegistry.counter("gateway.audit.published").count()).isEqualTo(1.0);
    }

    @Test
    void fullQueueShouldDropOldestEvent() {
        AuditPublisher publisher = new AuditPublisher(batches::add, 3, 10, Duration.ofSeconds(1), meterRegistry);

        for (int i = 1; i <= 5; i++) {
            publisher.publish(event("r" + i));
        }

        assertThat(publisher.pending()).isEqualTo(3);
        assertThat(publisher.droppedCount()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("gateway.audit.dropped").count()).isEqualTo(2.0);

        publisher.drain();
        assertThat(batches).hasSize(1);
        assertThat(batches.get(0)).extracting(AuditEvent::requestId).containsExactly("r3", "r4", "r5");
    }

    @Test
    void drainShouldDeliverInBatches() {
        AuditPublisher publisher = new AuditPublisher(batches::add, 100, 4, Duration.ofSeconds(1), meterRegistry);
        for (int i = 0; i < 10; i++) {
            publisher.publish(event("r" + i));
        }

        int delivered = publisher.drain();

        assertThat(delivered).isEqualTo(10);
        assertThat(batches).extracting(List::size).containsExactly(4, 4, 2);
        assertThat(publisher.pending()).isZero();
    }

    @Test
    void failingSinkShouldNotPropagate() {
        AuditPublisher publisher = new AuditPublisher(batch -> {
            throw new IllegalStateException("sink down");
        }, 10, 5, Duration.ofSeconds(1), meterRegistry);
        publisher.publish(event("r1"));

        assertThat(publisher.drain()).isZero();
    }

    @Test
    void stopShouldFlushPendingEvents() {
        AuditPublisher publisher = new AuditPublisher(batches::add, 10, 5, Duration.ofHours(1), meterRegistry);
        publisher.start();
        publisher.publish(event("r1"));
        publisher.publish(event("r2"));

        publisher.stop();

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0)).hasSize(2);
    }

    @Test
    void nullAttributesShouldBeSkipped() {
        assertThat(event("r1").attributes()).containsOnlyKeys("provider");
    }
}
