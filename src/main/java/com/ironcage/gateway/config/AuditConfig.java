package com.ironcage.gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.audit")
public class AuditConfig {

    private int queueCapacity = 10_000;

    private Duration drainInterval = Duration.ofMillis(250);

    private int batchSize = 500;
}
