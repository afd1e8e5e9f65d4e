package com.eyelevel.documentcompressor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configures the managed thread pools of the compression pipeline.
 * <p>
 * Worker loops and codec invocations run on separate pools so a codec that overruns its timeout
 * can be interrupted without taking a worker thread with it.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * One thread per worker loop. Sized from {@code app.compression.worker.concurrency}.
     */
    @Bean("compressionWorkerExecutor")
    public ThreadPoolTaskExecutor compressionWorkerExecutor(CompressionProperties properties) {
        int concurrency = Math.max(1, properties.getWorker().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("compress-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Runs the codec calls themselves, so the invoking worker can enforce a wall-clock timeout.
     */
    @Bean("codecExecutor")
    public ThreadPoolTaskExecutor codecExecutor(CompressionProperties properties) {
        int concurrency = Math.max(1, properties.getWorker().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency * 2);
        executor.setQueueCapacity(concurrency * 4);
        executor.setThreadNamePrefix("codec-");
        executor.initialize();
        return executor;
    }

    /**
     * UTC, matching {@code hibernate.jdbc.time_zone}.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
