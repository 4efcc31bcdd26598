package com.ironcage.gateway.config;

import com.ironcage.gateway.resilience.BreakerSettings;
import com.ironcage.gateway.resilience.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker, retry and timeout settings for provider calls.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.resilience")
public class ResilienceConfig {

    private Breaker breaker = new Breaker();

    private Retry retry = new Retry();

    /**
     * Timeout applied to each provider attempt, not to the whole request.
     */
    private Duration attemptTimeout = Duration.ofSeconds(30);

    public BreakerSettings breakerSettings() {
        return new BreakerSettings(breaker.failureThreshold, breaker.cooldown);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retry.maxAttempts, retry.baseDelay, retry.maxDelay, retry.jitterFactor);
    }

    @Getter
    @Setter
    public static class Breaker {
        /**
         * Consecutive recorded failures that open a provider's breaker.
         */
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double jitterFactor = 0.2;
    }
}
