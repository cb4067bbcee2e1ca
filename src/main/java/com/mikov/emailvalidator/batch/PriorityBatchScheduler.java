package com.mikov.emailvalidator.batch;

import com.mikov.emailvalidator.model.Priority;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates independent {@link BatchQueue}s that share one scheduler thread pool for drain
 * loops, item timeouts and inter-batch delays.
 *
 * @author zahari.mikov
 */
@Slf4j
@Getter
public class PriorityBatchScheduler {

    private final ScheduledExecutorService scheduler;
    private final Duration defaultItemTimeout;
    private final Duration interBatchDelay;
    private final Clock clock;

    public PriorityBatchScheduler(final ScheduledExecutorService scheduler, final Duration defaultItemTimeout,
                                  final Duration interBatchDelay, final Clock clock) {
        this.scheduler = scheduler;
        this.defaultItemTimeout = defaultItemTimeout;
        this.interBatchDelay = interBatchDelay;
        this.clock = clock;
        log.info("Batch scheduler ready: item timeout {} ms, inter-batch delay {} ms",
                defaultItemTimeout.toMillis(), interBatchDelay.toMillis());
    }

    public <T, R> BatchQueue<T, R> newQueue() {
        return newQueue(null, BatchListener.NO_OP);
    }

    /**
     * @param itemTimeout per-item timeout, or {@code null} for the configured default
     */
    public <T, R> BatchQueue<T, R> newQueue(final Duration itemTimeout, final BatchListener listener) {
        final var timeout = itemTimeout != null ? itemTimeout : defaultItemTimeout;
        return new BatchQueue<>(scheduler, timeout, interBatchDelay, listener, clock);
    }

    /**
     * Runs the items on a fresh queue of their own.
     */
    public <T, R> CompletableFuture<List<ItemResult<R>>> enqueue(final List<BatchItem<T, R>> items,
                                                                 final Priority priority) {
        final BatchQueue<T, R> queue = newQueue();
        return queue.enqueue(items, priority);
    }
}
