package com.designsync.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${designsync.classifier.executor-threads:4}")
    private int executorThreads;

    @Value("${designsync.classifier.queue-capacity:500}")
    private int queueCapacity;

    /**
     * Runs external classifier requests; one task per ambiguous node.
     * When threads and queue are full the submitting thread runs the request itself.
     */
    @Bean(name = "classifierExecutor")
    public Executor classifierExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(executorThreads);
        executor.setMaxPoolSize(executorThreads);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("classifier-");
        executor.initialize();
        return executor;
    }
}
