package com.example.draftarchiver.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${draft.assets.executor.pool-size:8}")
    private int fetchPoolSize;

    @Value("${draft.assets.executor.queue-capacity:100}")
    private int fetchQueueCapacity;

    @Value("${async.general.pool-size:2}")
    private int generalPoolSize;

    /**
     * Shared pool for asset downloads. Per-run concurrency is bounded separately by the orchestrator.
     * Saturation rejects the task; the orchestrator waits and resubmits, so fetches never run on the caller's thread.
     */
    @Bean(name = "assetFetchExecutor")
    public ThreadPoolTaskExecutor assetFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetchPoolSize);
        executor.setMaxPoolSize(fetchPoolSize);
        executor.setQueueCapacity(fetchQueueCapacity);
        executor.setThreadNamePrefix("asset-fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Asset fetch executor configured - Pool: {}, Queue: {}", fetchPoolSize, fetchQueueCapacity);
        return executor;
    }

    // Default executor for @Async methods
    @Bean(name = "asyncTaskExecutor")
    public ThreadPoolTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generalPoolSize);
        executor.setMaxPoolSize(generalPoolSize);
        executor.setThreadNamePrefix("async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return asyncTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable ex, Method method, Object... params) ->
                log.error("Unhandled exception caught in @Async method '{}' with parameters {}:",
                method.getName(), Arrays.toString(params), ex);
    }
}
