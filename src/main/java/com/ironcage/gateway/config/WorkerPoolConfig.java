package com.ironcage.gateway.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Bounded worker pool that request orchestration runs on.
 * Sized to available cores plus headroom for requests parked on I/O.
 */
@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.workers")
public class WorkerPoolConfig {

    private int ioHeadroom = 16;

    private int queuedTaskCap = 10_000;

    @Bean(destroyMethod = "dispose")
    public Scheduler gatewayWorkers() {
        int threads = Runtime.getRuntime().availableProcessors() + ioHeadroom;
        log.info("Gateway worker pool: {} threads, {} queued tasks max", threads, queuedTaskCap);
        return Schedulers.newBoundedElastic(threads, queuedTaskCap, "gateway-worker");
    }
}
