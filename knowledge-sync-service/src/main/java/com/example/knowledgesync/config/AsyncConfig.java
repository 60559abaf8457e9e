package com.example.knowledgesync.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for background ("fire-and-forget") sync runs.
 *
 * Only one run is allowed at a time (see SyncTriggerService), so a single worker
 * with a tiny queue is enough. AbortPolicy surfaces saturation as RejectedExecutionException,
 * which the web layer maps to 503.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(
            @Value("${sync.async.core-pool-size:1}") int corePoolSize,
            @Value("${sync.async.max-pool-size:1}") int maxPoolSize,
            @Value("${sync.async.queue-capacity:1}") int queueCapacity,
            @Value("${sync.async.thread-name-prefix:knowledge-sync-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // Let an in-flight run finish its current batch on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("Initialized syncTaskExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
        return executor;
    }

    /**
     * Copies the caller's MDC (correlation id) into the worker thread and clears it afterwards.
     */
    public static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();

            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
