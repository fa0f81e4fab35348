package com.example.vidorchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String QUEUE_WORKER_EXECUTOR = "queueWorkerExecutor";

    private final int workerPoolSize;

    public AsyncConfig(@Value("${processing.queue.worker-pool-size:3}") int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    /**
     * Executor for {@code @Async} listeners (completion finalization).
     */
    @Bean
    @Primary
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-");
        executor.initialize();
        return executor;
    }

    /**
     * Workers running queue items. No backlog: the queue itself is the backlog, so the
     * scheduler only dispatches while a worker is free.
     */
    @Bean(name = QUEUE_WORKER_EXECUTOR)
    public AsyncTaskExecutor queueWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerPoolSize);
        executor.setMaxPoolSize(workerPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("queue-worker-");
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
