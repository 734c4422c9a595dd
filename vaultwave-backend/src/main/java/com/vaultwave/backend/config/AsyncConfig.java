package com.vaultwave.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // Bounded pool for download packaging; kept apart from request threads
    @Bean(name = "packagingExecutor")
    public ThreadPoolTaskExecutor packagingExecutor(
            @Value("${app.downloads.worker.pool-size:4}") int poolSize,
            @Value("${app.downloads.worker.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("packaging-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        // A full queue throws TaskRejectedException back to the dispatcher, which fails the job
        executor.initialize();
        return executor;
    }
}
