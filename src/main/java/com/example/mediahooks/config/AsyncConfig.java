package com.example.mediahooks.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Two pools: event bus handlers run on {@code taskExecutor}, individual
 * webhook deliveries on {@code webhookExecutor}. A handler blocks while its
 * deliveries run, so they must not share a pool.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "taskExecutor")
    public Executor taskExecutor(
            @Value("${app.async.events.core-pool-size:4}") int corePoolSize,
            @Value("${app.async.events.max-pool-size:16}") int maxPoolSize,
            @Value("${app.async.events.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("Event-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "webhookExecutor")
    public Executor webhookExecutor(
            @Value("${app.async.webhooks.core-pool-size:10}") int corePoolSize,
            @Value("${app.async.webhooks.max-pool-size:50}") int maxPoolSize,
            @Value("${app.async.webhooks.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // Core pool size: threads to keep alive
        executor.setCorePoolSize(corePoolSize);
        // Max pool size: max threads to allow
        executor.setMaxPoolSize(maxPoolSize);
        // Queue capacity: tasks to buffer
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("Webhook-");
        executor.initialize();
        return executor;
    }
}
