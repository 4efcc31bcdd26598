package com.ironcage.gateway.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget audit emission.
 *
 * {@link #publish} only enqueues and never blocks or fails the request path. The queue is
 * bounded; when full the oldest event is dropped and counted in
 * {@code gateway.audit.dropped}. A single background task drains the queue into the
 * {@link AuditSink} in batches.
 */
@Slf4j
public class AuditPublisher {

    private final AuditSink sink;
    private final int capacity;
    private final int batchSize;
    private final Duration drainInterval;
    private final Counter published;
    private final Counter dropped;

    private final ArrayDeque<AuditEvent> queue = new ArrayDeque<>();
    private Scheduler drainScheduler;
    private Disposable drainTask;

    public AuditPublisher(AuditSink sink, int capacity, int batchSize, Duration drainInterval, MeterRegistry meterRegistry) {
        if (capacity < 1 || batchSize < 1) {
            throw new IllegalArgumentException("Audit queue capacity and batch size must be positive");
        }
        this.sink = sink;
        this.capacity = capacity;
        this.batchSize = batchSize;
        this.drainInterval = drainInterval;
        this.published = Counter.builder("gateway.audit.published")
                .description("Audit events accepted for delivery")
                .register(meterRegistry);
        this.dropped = Counter.builder("gateway.audit.dropped")
                .description("Audit events dropped because the queue was full")
                .register(meterRegistry);
    }

    public void publish(AuditEvent event) {
        boolean overflowed = false;
        synchronized (queue) {
            if (queue.size() >= capacity) {
                queue.pollFirst();
                overflowed = true;
            }
            queue.addLast(event);
        }
        published.increment();
        if (overflowed) {
            dropped.increment();
            log.debug("Audit queue full, dropped oldest event");
        }
    }

    /**
     * Delivers up to one batch per call until the queue is empty.
     *
     * @return number of events handed to the sink
     */
    public int drain() {
        int delivered = 0;
        while (true) {
            List<AuditEvent> batch = new ArrayList<>(batchSize);
            synchronized (queue) {
                while (batch.size() < batchSize && !queue.isEmpty()) {
                    batch.add(queue.pollFirst());
                }
            }
            if (batch.isEmpty()) {
                return delivered;
            }
            try {
                sink.write(batch);
                delivered += batch.size();
            } catch (RuntimeException e) {
                log.error("Audit sink rejected a batch of {} events: {}", batch.size(), e.getMessage());
                return delivered;
            }
        }
    }

    public int pending() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public double droppedCount() {
        return dropped.count();
    }

    public synchronized void start() {
        if (drainTask != null) {
            return;
        }
        drainScheduler = Schedulers.newSingle("audit-drain");
        long periodMillis = drainInterval.toMillis();
        drainTask = drainScheduler.schedulePeriodically(this::drain, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Audit publisher started (capacity {}, batch {}, every {}ms)", capacity, batchSize, periodMillis);
    }

    public synchronized void stop() {
        if (drainTask == null) {
            return;
        }
        drainTask.dispose();
        drainScheduler.dispose();
        drainTask = null;
        int flushed = drain();
        log.info("Audit publisher stopped, flushed {} events", flushed);
    }
}
