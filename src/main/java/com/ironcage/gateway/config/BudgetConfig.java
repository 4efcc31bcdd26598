package com.ironcage.gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.budget")
public class BudgetConfig {

    /**
     * Percentage of the limit at which a non-blocking warning is emitted.
     */
    private int softThresholdPercent = 90;

    /**
     * Lifetime of an unresolved reservation before the sweeper releases it.
     */
    private Duration reservationTtl = Duration.ofMinutes(5);

    /**
     * Interval between expiry sweeps.
     */
    private Duration sweepInterval = Duration.ofSeconds(30);

    /**
     * Ledger persistence: {@code memory} or {@code redis}.
     */
    private String store = "memory";
}
