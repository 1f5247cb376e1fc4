package com.subradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Named thread pools. link-resolution fans out cancellation link lookups across groups of one analysis.
 */
@Configuration
public class AsyncConfig {

    public static final String LINK_RESOLUTION_EXECUTOR = "link-resolution-executor";

    /**
     * Rejects when the queue is full so lookups never run on the analyzing thread outside the resolution
     * deadline; rejected groups get the search fallback.
     */
    @Bean(name = LINK_RESOLUTION_EXECUTOR)
    public Executor linkResolutionExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("link-resolution-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        e.initialize();
        return e;
    }
}
