package net.imagecraft.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for work that runs off the caller's thread.
 */
@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for batch generation units.
     *
     * <p>Core and max sizes are equal so the pool never grows past the configured concurrency;
     * extra units wait in the queue. Shutdown waits for running units so no job is left
     * half-recorded.</p>
     */
    @Bean("batchExecutor")
    public AsyncTaskExecutor batchExecutor(ImageCraftProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int poolSize = properties.getBatch().getPoolSize();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(500, properties.getBatch().getMaxJobUnits() * 4));
        executor.setThreadNamePrefix("batch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
