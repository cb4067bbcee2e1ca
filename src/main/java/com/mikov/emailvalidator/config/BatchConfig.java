package com.mikov.emailvalidator.config;

import com.mikov.emailvalidator.batch.PriorityBatchScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Configuration
public class BatchConfig {

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService batchScheduler(final ValidatorProperties properties) {
        final var threadFactory = new CustomizableThreadFactory("batch-");
        threadFactory.setDaemon(true);
        final var executor = new ScheduledThreadPoolExecutor(properties.getBatch().getSchedulerThreads(), threadFactory);
        // item timers are cancelled as soon as the item settles
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public PriorityBatchScheduler priorityBatchScheduler(final ScheduledExecutorService batchScheduler,
                                                         final ValidatorProperties properties, final Clock clock) {
        final var batch = properties.getBatch();
        return new PriorityBatchScheduler(batchScheduler, batch.getItemTimeout(), batch.getInterBatchDelay(), clock);
    }

    /**
     * Executor for handing finished results to the sink, so persistence never delays a response.
     */
    @Bean
    public ThreadPoolTaskExecutor resultSinkExecutor(final ValidatorProperties properties) {
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getBatch().getSinkThreads());
        executor.setMaxPoolSize(properties.getBatch().getSinkThreads());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("result-sink-");
        executor.initialize();
        return executor;
    }
}
