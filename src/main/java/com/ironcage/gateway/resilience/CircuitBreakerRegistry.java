package com.ironcage.gateway.resilience;

import com.ironcage.gateway.provider.ProviderCallException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * One Resilience4j breaker per downstream dependency, created on first use.
 * A failing dependency never affects the breaker of another one.
 *
 * Breakers open once the last {@code failureThreshold} recorded outcomes are all failures
 * and allow a single call in HALF_OPEN. Cooldowns are measured on the gateway clock: an
 * OPEN breaker is moved to HALF_OPEN here once its cooldown has elapsed, and a HALF_OPEN
 * breaker whose trial call has not reported back within a cooldown is re-armed for a new one.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry delegate;
    private final BreakerSettings settings;
    private final Clock clock;
    private final ConcurrentHashMap<String, Long> lastTransitionAt = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(BreakerSettings settings, Clock clock) {
        this(settings, clock, ProviderCallException::countsAgainstProvider);
    }

    public CircuitBreakerRegistry(BreakerSettings settings, Clock clock, Predicate<Throwable> recordFailure) {
        this.settings = settings;
        this.clock = clock;
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.failureThreshold())
                .minimumNumberOfCalls(settings.failureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(settings.cooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordException(recordFailure)
                .build();
        this.delegate = io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry.of(config);
    }

    /**
     * The breaker for a dependency, with any cooldown that has elapsed applied.
     */
    public CircuitBreaker breaker(String dependency) {
        CircuitBreaker breaker = delegate.circuitBreaker(dependency);
        lastTransitionAt.computeIfAbsent(dependency, name -> {
            breaker.getEventPublisher().onStateTransition(event -> {
                lastTransitionAt.put(name, clock.millis());
                log.info("Circuit breaker {} {}", name, event.getStateTransition());
            });
            return clock.millis();
        });
        advance(breaker);
        return breaker;
    }

    public CircuitState stateOf(String dependency) {
        if (delegate.find(dependency).isEmpty()) {
            return CircuitState.CLOSED;
        }
        return toCircuitState(breaker(dependency).getState());
    }

    public boolean isOpen(String dependency) {
        return stateOf(dependency) == CircuitState.OPEN;
    }

    public int failureCount(String dependency) {
        if (delegate.find(dependency).isEmpty()) {
            return 0;
        }
        return breaker(dependency).getMetrics().getNumberOfFailedCalls();
    }

    public Map<String, BreakerSnapshot> snapshots() {
        Map<String, BreakerSnapshot> result = new TreeMap<>();
        delegate.getAllCircuitBreakers().forEach(breaker -> {
            advance(breaker);
            result.put(breaker.getName(), new BreakerSnapshot(toCircuitState(breaker.getState()),
                    breaker.getMetrics().getNumberOfFailedCalls()));
        });
        return result;
    }

    private void advance(CircuitBreaker breaker) {
        CircuitBreaker.State state = breaker.getState();
        if (state != CircuitBreaker.State.OPEN && state != CircuitBreaker.State.HALF_OPEN) {
            return;
        }
        synchronized (breaker) {
            Long since = lastTransitionAt.get(breaker.getName());
            if (since == null || clock.millis() - since < settings.cooldown().toMillis()) {
                return;
            }
            if (breaker.getState() == CircuitBreaker.State.OPEN) {
                breaker.transitionToHalfOpenState();
            } else if (breaker.getState() == CircuitBreaker.State.HALF_OPEN) {
                log.warn("Circuit breaker {} trial call did not report back, admitting a new one", breaker.getName());
                breaker.transitionToOpenState();
                breaker.transitionToHalfOpenState();
            }
        }
    }

    private static CircuitState toCircuitState(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }
}
