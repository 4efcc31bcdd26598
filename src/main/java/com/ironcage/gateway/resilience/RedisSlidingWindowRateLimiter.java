package com.ironcage.gateway.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Cluster-wide variant of {@link SlidingWindowRateLimiter} backed by Redis counters.
 *
 * Each fixed window is a counter under {@code rate_limit:{key}:{windowIndex}} with a TTL
 * of two windows, so Redis expiry does the decay. The previous window's counter is
 * weighted the same way as in memory. Check and increment run as one Lua script and a
 * refused request is never counted.
 * If Redis is unreachable the request is let through and the failure is logged.
 */
@Slf4j
public class RedisSlidingWindowRateLimiter implements RateLimiter {

    private static final String RATE_LIMIT_KEY_PREFIX = "rate_limit:";

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> CHECK_SCRIPT = RedisScript.of("""
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            local previous = tonumber(redis.call('GET', KEYS[2]) or '0')
            if previous * tonumber(ARGV[1]) + current + 1 > tonumber(ARGV[2]) then
              return {0, current, previous}
            end
            current = redis.call('INCR', KEYS[1])
            if current == 1 then
              redis.call('PEXPIRE', KEYS[1], ARGV[3])
            end
            return {1, current, previous}
            """, List.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final long limit;
    private final Duration window;
    private final Clock clock;

    public RedisSlidingWindowRateLimiter(ReactiveRedisTemplate<String, String> redisTemplate,
                                         long limit, Duration window, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.limit = limit;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public Mono<RateLimitDecision> check(String key) {
        long now = clock.millis();
        long windowMillis = window.toMillis();
        long index = now / windowMillis;
        long elapsed = now - index * windowMillis;
        double weight = 1.0 - (double) elapsed / windowMillis;
        String prefix = RATE_LIMIT_KEY_PREFIX + "{" + key + "}:";
        List<String> keys = List.of(prefix + index, prefix + (index - 1));
        List<String> args = List.of(String.valueOf(weight), String.valueOf(limit),
                String.valueOf(window.multipliedBy(2).toMillis()));

        return redisTemplate.execute(CHECK_SCRIPT, keys, args)
                .next()
                .map(result -> {
                    long current = ((Number) result.get(1)).longValue();
                    long previous = ((Number) result.get(2)).longValue();
                    if (((Number) result.get(0)).longValue() == 0L) {
                        log.warn("Rate limit exceeded for key: {}", key);
                        return RateLimitDecision.limited(limit, Duration.ofMillis(windowMillis - elapsed));
                    }
                    double estimate = previous * weight + current;
                    return RateLimitDecision.allowed(limit, (long) Math.max(0, Math.floor(limit - estimate)));
                })
                .onErrorResume(e -> {
                    log.error("Rate limiting check failed for {}: {}", key, e.getMessage());
                    return Mono.just(RateLimitDecision.allowed(limit, 0));
                });
    }
}
