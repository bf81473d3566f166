package com.platform.driftengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for monitor evaluation and snapshot fetching.
 */
@Configuration
public class DriftEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(DriftEngineConfig.class);

    @Value("${drift-engine.evaluator.parallelism:4}")
    private int evaluatorParallelism;

    @Value("${drift-engine.fetch.parallelism:2}")
    private int fetchParallelism;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService monitorExecutor() {
        log.info("Monitor evaluation pool: {} threads", evaluatorParallelism);
        return Executors.newFixedThreadPool(Math.max(1, evaluatorParallelism), named("drift-monitor"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService fetchExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, fetchParallelism), named("drift-fetch"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
