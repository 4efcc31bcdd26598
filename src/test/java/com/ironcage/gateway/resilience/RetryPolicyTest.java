package com.ironcage.gateway.resilience;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void backoffShouldDoubleBetweenAttemptsWithoutJitter() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(10), 0.0);
        AtomicInteger subscriptions = new AtomicInteger();
        Mono<String> source = failingTimes(2, subscriptions);

        StepVerifier.withVirtualTime(() -> source.retryWhen(policy.toRetrySpec(error -> true)))
                .expectSubscription()
                .then(() -> assertThat(subscriptions).hasValue(1))
                .thenAwait(Duration.ofMillis(100))
                .then(() -> assertThat(subscriptions).hasValue(2))
                .thenAwait(Duration.ofMillis(199))
                .then(() -> assertThat(subscriptions).hasValue(2))
                .thenAwait(Duration.ofMillis(1))
                .expectNext("ok")
                .verifyComplete();
    }

    @Test
    void exhaustedRetriesShouldPropagateLastError() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.0);
        AtomicInteger subscriptions = new AtomicInteger();
        IllegalStateException failure = new IllegalStateException("down");
        Mono<String> source = Mono.defer(() -> {
            subscriptions.incrementAndGet();
            return Mono.error(failure);
        });

        StepVerifier.create(source.retryWhen(policy.toRetrySpec(error -> true)))
                .expectErrorSatisfies(error -> assertThat(error).isSameAs(failure))
                .verify();

        assertThat(subscriptions).hasValue(3);
    }

    @Test
    void nonRetryableErrorShouldFailOnFirstAttempt() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.0);
        AtomicInteger subscriptions = new AtomicInteger();

        StepVerifier.create(failingTimes(5, subscriptions)
                        .retryWhen(policy.toRetrySpec(error -> !(error instanceof IllegalStateException))))
                .expectError(IllegalStateException.class)
                .verify();

        assertThat(subscriptions).hasValue(1);
    }

    @Test
    void noRetryShouldNotRetry() {
        assertThat(RetryPolicy.noRetry().retries()).isFalse();
        assertThat(new RetryPolicy(2, Duration.ZERO, Duration.ZERO, 0.0).retries()).isTrue();
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Mono<String> failingTimes(int failures, AtomicInteger subscriptions) {
        return Mono.defer(() -> subscriptions.incrementAndGet() <= failures
                ? Mono.error(new IllegalStateException("down"))
                : Mono.just("ok"));
    }
}
