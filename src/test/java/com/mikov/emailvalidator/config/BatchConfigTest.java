package com.mikov.emailvalidator.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchConfigTest {

    @Test
    void cancelledTimersLeaveTheSchedulerQueue() {
        final var properties = new ValidatorProperties();
        final var scheduler = assertInstanceOf(ScheduledThreadPoolExecutor.class,
                new BatchConfig().batchScheduler(properties));
        try {
            assertTrue(scheduler.getRemoveOnCancelPolicy());
            assertEquals(properties.getBatch().getSchedulerThreads(), scheduler.getCorePoolSize());

            final var timer = scheduler.schedule(() -> { }, 1, TimeUnit.HOURS);
            assertEquals(1, scheduler.getQueue().size());
            timer.cancel(false);
            assertTrue(scheduler.getQueue().isEmpty());
        } finally {
            scheduler.shutdownNow();
        }
    }
}
