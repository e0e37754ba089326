package com.dev.sacudo.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools behind the session contexts, resolution jobs, voice joins and extraction attempts.
 *
 * <p>Every pool copies the submitting thread's MDC onto the worker so that log lines keep the guild they
 * belong to.
 */
@Configuration
public class ExecutorConfig {

    private final ExecutorProperties properties;

    public ExecutorConfig(ExecutorProperties properties) {
        this.properties = properties;
    }

    /**
     * Shared threads for all per-guild serialized contexts. A guild never occupies more than one thread at a
     * time; rejected work runs on the submitting thread, which keeps ordering because each guild's own queue
     * only releases one task at a time.
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        return pool(properties.session(), "session-", new ThreadPoolExecutor.CallerRunsPolicy(), false);
    }

    /**
     * Resolution jobs. These block on network I/O and must never run on a session thread, so saturation is
     * reported instead of falling back to the caller.
     */
    @Bean(name = "ioExecutor")
    public ThreadPoolTaskExecutor ioExecutor() {
        return elasticPool(properties.io(), "io-");
    }

    /**
     * Voice joins, kept apart from resolution jobs so one guild's slow resolutions cannot delay another
     * guild's join past its timeout.
     */
    @Bean(name = "joinExecutor")
    public ThreadPoolTaskExecutor joinExecutor() {
        return elasticPool(properties.join(), "join-");
    }

    @Bean(name = "extractorExecutor")
    public ThreadPoolTaskExecutor extractorExecutor() {
        return elasticPool(properties.extractor(), "extractor-");
    }

    @Bean(name = "sacudoScheduler")
    public ThreadPoolTaskScheduler sacudoScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.schedulerPoolSize());
        scheduler.setThreadNamePrefix("sacudo-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setTaskDecorator(mdcPropagation());
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor pool(ExecutorProperties.Pool pool, String prefix,
                                        RejectedExecutionHandler rejectionPolicy, boolean idleCoreThreadsExpire) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.corePoolSize());
        executor.setMaxPoolSize(Math.max(pool.corePoolSize(), pool.maxPoolSize()));
        executor.setQueueCapacity(pool.queueCapacity());
        executor.setKeepAliveSeconds(pool.keepAliveSeconds());
        executor.setAllowCoreThreadTimeOut(idleCoreThreadsExpire);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * A pool that starts a new thread for each task until {@code maxPoolSize} threads are busy, and only then
     * queues. A plain core/max pool would queue behind its core threads and never grow until the queue filled.
     */
    private ThreadPoolTaskExecutor elasticPool(ExecutorProperties.Pool pool, String prefix) {
        int size = Math.max(pool.corePoolSize(), pool.maxPoolSize());
        return pool(new ExecutorProperties.Pool(size, size, pool.queueCapacity(), pool.keepAliveSeconds()), prefix,
                new ThreadPoolExecutor.AbortPolicy(), true);
    }

    static TaskDecorator mdcPropagation() {
        return runnable -> {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
