package com.ironcage.gateway.resilience;

import com.ironcage.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings({"unchecked", "rawtypes"})
class RedisSlidingWindowRateLimiterTest {

    private MutableClock clock;
    private ReactiveRedisTemplate<String, String> redisTemplate;
    private RedisSlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        clock.advance(Duration.ofSeconds(15));
        redisTemplate = mock(ReactiveRedisTemplate.class);
        limiter = new RedisSlidingWindowRateLimiter(redisTemplate, 10, Duration.ofSeconds(60), clock);
    }

    @Test
    void checkShouldRunAsOneScriptWithWeightLimitAndTtl() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyList()))
                .thenReturn(Flux.just(List.of(1L, 1L, 0L)));

        limiter.check("agent:a").block();

        ArgumentCaptor<List> keys = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(any(RedisScript.class), keys.capture(), args.capture());
        long index = clock.millis() / 60_000;
        assertThat(keys.getValue()).containsExactly(
                "rate_limit:{agent:a}:" + index, "rate_limit:{agent:a}:" + (index - 1));
        assertThat(args.getValue()).containsExactly("0.75", "10", "120000");
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    void admittedRequestShouldReportWeightedRemaining() {
        // 2 previous * 0.75 + 4 current = 5.5
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyList()))
                .thenReturn(Flux.just(List.of(1L, 4L, 2L)));

        StepVerifier.create(limiter.check("agent:a"))
                .assertNext(decision -> {
                    assertThat(decision.allowed()).isTrue();
                    assertThat(decision.remaining()).isEqualTo(4);
                })
                .verifyComplete();
    }

    @Test
    void refusedRequestShouldNotIncrementAnyCounter() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyList()))
                .thenReturn(Flux.just(List.of(0L, 10L, 0L)));

        StepVerifier.create(limiter.check("agent:a"))
                .assertNext(decision -> {
                    assertThat(decision.allowed()).isFalse();
                    assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(45));
                })
                .verifyComplete();

        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    void redisFailureShouldLetRequestThrough() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyList()))
                .thenReturn(Flux.error(new IllegalStateException("connection refused")));

        StepVerifier.create(limiter.check("agent:a"))
                .assertNext(decision -> assertThat(decision.allowed()).isTrue())
                .verifyComplete();
    }
}
