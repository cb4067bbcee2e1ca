package com.mikov.emailvalidator.batch;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * A unit of work handed to a {@link BatchQueue}. The completion future is bound at
 * construction and resolved exactly once, by the queue.
 *
 * @author zahari.mikov
 */
@Getter
public class BatchItem<T, R> {

    private final String id;
    private final T payload;
    private final Function<T, CompletableFuture<R>> processor;

    @Getter(AccessLevel.NONE)
    private final CompletableFuture<R> completion = new CompletableFuture<>();

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean resolved = new AtomicBoolean();

    public BatchItem(final String id, final T payload, final Function<T, CompletableFuture<R>> processor) {
        if (id == null || processor == null) {
            throw new IllegalArgumentException("Batch item requires an id and a processor");
        }
        this.id = id;
        this.payload = payload;
        this.processor = processor;
    }

    /**
     * A view of the completion future. Completing the returned copy does not resolve the item.
     */
    public CompletableFuture<R> completion() {
        return completion.copy();
    }

    public boolean isResolved() {
        return resolved.get();
    }

    void succeed(final R value) {
        markResolved();
        completion.complete(value);
    }

    void fail(final Throwable cause) {
        markResolved();
        completion.completeExceptionally(cause);
    }

    private void markResolved() {
        if (!resolved.compareAndSet(false, true)) {
            throw new IllegalStateException("Batch item " + id + " already resolved");
        }
    }
}
