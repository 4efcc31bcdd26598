package com.ironcage.gateway.resilience;

import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process sliding-window limiter using two weighted fixed windows.
 *
 * The estimated count is {@code previous * (1 - elapsedFraction) + current}; the
 * approximation never admits more than twice the configured rate in any window-length
 * span. Counters decay purely by clock arithmetic at check time. Idle keys are pruned
 * opportunistically once the key set grows past {@code maxKeys}.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final int DEFAULT_MAX_KEYS = 100_000;

    private final long limit;
    private final long windowMillis;
    private final Clock clock;
    private final int maxKeys;
    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(long limit, Duration window, Clock clock) {
        this(limit, window, clock, DEFAULT_MAX_KEYS);
    }

    public SlidingWindowRateLimiter(long limit, Duration window, Clock clock, int maxKeys) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.maxKeys = maxKeys;
    }

    @Override
    public Mono<RateLimitDecision> check(String key) {
        return Mono.fromSupplier(() -> tryAcquire(key));
    }

    RateLimitDecision tryAcquire(String key) {
        long now = clock.millis();
        if (windows.size() > maxKeys) {
            prune(now);
        }
        Window window = windows.computeIfAbsent(key, k -> new Window());
        synchronized (window) {
            window.roll(now, windowMillis);
            long elapsed = now - window.start;
            double previousWeight = 1.0 - (double) elapsed / windowMillis;
            double estimate = window.previous * previousWeight + window.current;
            if (estimate + 1 > limit) {
                return RateLimitDecision.limited(limit, retryAfter(window, elapsed));
            }
            window.current++;
            long remaining = (long) Math.max(0, Math.floor(limit - estimate - 1));
            return RateLimitDecision.allowed(limit, remaining);
        }
    }

    private Duration retryAfter(Window window, long elapsed) {
        long waitMillis;
        if (window.current + 1 <= limit && window.previous > 0) {
            // Only the previous window's weighted share is in the way.
            double needed = windowMillis * (1.0 - (double) (limit - window.current - 1) / window.previous);
            waitMillis = (long) Math.ceil(needed) - elapsed;
        } else {
            // The current window alone is full: it has to roll over and then decay.
            double intoNext = windowMillis * (1.0 - (double) (limit - 1) / Math.max(1, window.current));
            waitMillis = (windowMillis - elapsed) + (long) Math.ceil(Math.max(0, intoNext));
        }
        return Duration.ofMillis(Math.max(1, waitMillis));
    }

    private void prune(long now) {
        windows.entrySet().removeIf(entry -> {
            Window window = entry.getValue();
            synchronized (window) {
                return now - window.start >= 2 * windowMillis;
            }
        });
    }

    private static final class Window {
        private long start;
        private long previous;
        private long current;

        void roll(long now, long windowMillis) {
            long alignedStart = now - Math.floorMod(now, windowMillis);
            if (alignedStart == start) {
                return;
            }
            previous = alignedStart - start == windowMillis ? current : 0;
            current = 0;
            start = alignedStart;
        }
    }
}
