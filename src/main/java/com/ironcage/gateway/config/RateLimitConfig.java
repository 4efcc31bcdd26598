package com.ironcage.gateway.config;

import com.ironcage.gateway.resilience.RateLimitKeyStrategy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.rate-limit")
public class RateLimitConfig {

    private int requestsPerWindow = 60;

    private Duration window = Duration.ofSeconds(60);

    private RateLimitKeyStrategy keyStrategy = RateLimitKeyStrategy.AGENT;

    /**
     * {@code memory} keeps counters in this process, {@code redis} shares them across the cluster.
     */
    private String store = "memory";
}
