package com.eyelevel.jobrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the bounded thread pool that runs chunk pipelines when a batch is allowed more
 * than one chunk in flight. The pool size is the configured max-in-flight bound and the queue is
 * unbounded, so a large batch never sees more concurrent submissions than the external workers
 * were sized for.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the chunk pipeline executor.
     *
     * @param config The relay configuration supplying {@code chunking.max-in-flight}.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("chunkTaskExecutor")
    public AsyncTaskExecutor chunkTaskExecutor(final JobRelayConfig config) {
        final int inFlight = Math.max(1, config.getChunking().getMaxInFlight());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(inFlight);
        executor.setMaxPoolSize(inFlight);
        executor.setThreadNamePrefix("chunk-pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
