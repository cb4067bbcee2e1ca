package com.mikov.emailvalidator.batch;

import com.mikov.emailvalidator.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Priority-bucketed work queue that drains in size-adaptive batches.
 * <p>
 * The queue is either idle or draining. Enqueueing while idle starts the drain loop on the
 * scheduler; the loop takes a batch from the highest-weight buckets first, runs all of its
 * items concurrently, waits for every one of them to settle, then schedules the next batch
 * after the inter-batch delay. Batches never overlap. The loop stops once all buckets are empty.
 * <p>
 * Each item is raced against the item timeout. A timed-out processor is abandoned and its
 * late result ignored.
 *
 * @author zahari.mikov
 */
public class BatchQueue<T, R> {
    private static final Logger logger = LoggerFactory.getLogger(BatchQueue.class);

    private final ScheduledExecutorService scheduler;
    private final Duration itemTimeout;
    private final Duration interBatchDelay;
    private final BatchListener listener;
    private final BatchStatistics statistics;

    private final Object lock = new Object();
    private final Map<Priority, Deque<BatchItem<T, R>>> buckets = new EnumMap<>(Priority.class);
    private boolean draining;
    private int batchNumber;
    private CompletableFuture<Void> idle = CompletableFuture.completedFuture(null);

    public BatchQueue(final ScheduledExecutorService scheduler, final Duration itemTimeout,
                      final Duration interBatchDelay, final BatchListener listener, final Clock clock) {
        if (itemTimeout.isNegative() || itemTimeout.isZero()) {
            throw new IllegalArgumentException("Item timeout must be positive: " + itemTimeout);
        }
        if (interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("Inter-batch delay must not be negative: " + interBatchDelay);
        }
        this.scheduler = scheduler;
        this.itemTimeout = itemTimeout;
        this.interBatchDelay = interBatchDelay;
        this.listener = listener != null ? listener : BatchListener.NO_OP;
        this.statistics = new BatchStatistics(clock);
        for (final var priority : Priority.values()) {
            buckets.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Adds items to the bucket for {@code priority} and starts draining if the queue is idle.
     *
     * @return future of one {@link ItemResult} per item, in input order. Fails only when the
     * enqueue itself is invalid, never because of an individual item.
     */
    public CompletableFuture<List<ItemResult<R>>> enqueue(final List<BatchItem<T, R>> items, final Priority priority) {
        if (priority == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Priority is required"));
        }
        if (items == null || items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        final List<CompletableFuture<ItemResult<R>>> outcomes = items.stream()
                .map(this::outcomeOf)
                .toList();

        synchronized (lock) {
            buckets.get(priority).addAll(items);
            if (!draining) {
                startDraining();
            }
        }
        logger.debug("Enqueued {} items at {} priority", items.size(), priority);

        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> outcomes.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Completes when the drain loop that was running (or last ran) at call time stops.
     */
    public CompletableFuture<Void> whenIdle() {
        synchronized (lock) {
            return idle;
        }
    }

    public boolean isDraining() {
        synchronized (lock) {
            return draining;
        }
    }

    public StatisticsSnapshot getStatistics() {
        return statistics.snapshot();
    }

    private void startDraining() {
        draining = true;
        idle = new CompletableFuture<>();
        statistics.markStarted();
        try {
            scheduler.execute(this::drainNext);
        } catch (final RejectedExecutionException e) {
            logger.error("Scheduler rejected drain loop, failing pending items", e);
            abortPending(e);
        }
    }

    private void drainNext() {
        final List<BatchItem<T, R>> batch;
        final int number;
        final CompletableFuture<Void> finished;
        synchronized (lock) {
            batch = takeBatch();
            if (batch.isEmpty()) {
                draining = false;
                statistics.markFinished();
                finished = idle;
                number = batchNumber;
            } else {
                finished = null;
                number = ++batchNumber;
            }
        }

        if (finished != null) {
            logger.info("Queue drained after {} batches: {}", number, statistics.snapshot());
            finished.complete(null);
            return;
        }

        logger.debug("Starting batch {} with {} items", number, batch.size());
        try {
            listener.onBatchStarted(number, batch.stream().map(BatchItem::getId).toList());
        } catch (final RuntimeException e) {
            logger.warn("Batch listener failed for batch {}", number, e);
        }

        final var running = batch.stream().map(this::runItem).toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(running).whenComplete((ignored, error) -> scheduleNext());
    }

    private void scheduleNext() {
        try {
            scheduler.schedule(this::drainNext, interBatchDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            logger.error("Scheduler rejected next batch, failing pending items", e);
            synchronized (lock) {
                abortPending(e);
            }
        }
    }

    /**
     * Must hold {@link #lock}.
     */
    private List<BatchItem<T, R>> takeBatch() {
        final var pending = buckets.values().stream().mapToInt(Deque::size).sum();
        if (pending == 0) {
            return List.of();
        }
        final var size = BatchSizing.optimalBatchSize(pending);
        final var batch = new ArrayList<BatchItem<T, R>>(Math.min(size, pending));
        for (final var priority : Priority.byWeightDescending()) {
            final var bucket = buckets.get(priority);
            while (batch.size() < size && !bucket.isEmpty()) {
                batch.add(bucket.poll());
            }
            if (batch.size() == size) {
                break;
            }
        }
        return batch;
    }

    /**
     * Must hold {@link #lock}.
     */
    private void abortPending(final Throwable cause) {
        for (final var bucket : buckets.values()) {
            while (!bucket.isEmpty()) {
                settle(bucket.poll(), null, cause);
            }
        }
        draining = false;
        statistics.markFinished();
        idle.complete(null);
    }

    private CompletableFuture<Void> runItem(final BatchItem<T, R> item) {
        final var race = new CompletableFuture<R>();

        ScheduledFuture<?> timer = null;
        try {
            timer = scheduler.schedule(() -> race.completeExceptionally(new ProcessingTimeoutException()),
                    itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            race.completeExceptionally(e);
        }

        if (!race.isDone()) {
            try {
                final var future = item.getProcessor().apply(item.getPayload());
                if (future == null) {
                    race.completeExceptionally(new IllegalStateException("Processor returned no future for " + item.getId()));
                } else {
                    future.whenComplete((value, error) -> {
                        if (error == null) {
                            race.complete(value);
                        } else {
                            race.completeExceptionally(unwrap(error));
                        }
                    });
                }
            } catch (final RuntimeException e) {
                race.completeExceptionally(e);
            }
        }

        final var timeoutTask = timer;
        return race.handle((value, error) -> {
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            settle(item, value, error);
            return null;
        });
    }

    private void settle(final BatchItem<T, R> item, final R value, final Throwable error) {
        try {
            if (error == null) {
                statistics.recordSuccess();
                item.succeed(value);
            } else {
                final var cause = unwrap(error);
                logger.debug("Item {} failed: {}", item.getId(), cause.getMessage());
                statistics.recordFailure();
                item.fail(cause);
            }
        } catch (final IllegalStateException e) {
            logger.error("Item {} was resolved twice", item.getId(), e);
        }
    }

    private CompletableFuture<ItemResult<R>> outcomeOf(final BatchItem<T, R> item) {
        return item.completion().handle((value, error) -> error == null
                ? ItemResult.success(item.getId(), value)
                : ItemResult.failure(item.getId(), unwrap(error)));
    }

    private static Throwable unwrap(final Throwable error) {
        var cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
