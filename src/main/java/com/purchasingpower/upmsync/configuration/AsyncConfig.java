package com.purchasingpower.upmsync.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for package syncs.
 *
 * Packages are independent, so a run over the whole config fans out
 * one task per package. Per-package serialization is enforced by the
 * orchestrator's lock, not by the pool.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "packageSyncExecutor")
    public ThreadPoolTaskExecutor packageSyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("package-sync-");

        // Large config sets overflow the queue; run the overflow on the caller
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // A commit in progress must not be cut short by shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);

        executor.initialize();

        log.info("✅ Package sync executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
