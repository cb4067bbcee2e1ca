package com.mikov.emailvalidator.batch;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for one {@link BatchQueue}. Processed is always successful + failed.
 * Start and end are captured at drain loop boundaries; a queue that drains more than
 * once keeps its first start.
 */
public class BatchStatistics {

    private final Clock clock;
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile long startNanos;
    private volatile long endNanos;

    public BatchStatistics(final Clock clock) {
        this.clock = clock;
    }

    synchronized void markStarted() {
        if (startTime == null) {
            startTime = clock.instant();
            startNanos = System.nanoTime();
        }
        endTime = null;
    }

    synchronized void markFinished() {
        endTime = clock.instant();
        endNanos = System.nanoTime();
    }

    void recordSuccess() {
        successful.incrementAndGet();
    }

    void recordFailure() {
        failed.incrementAndGet();
    }

    public synchronized StatisticsSnapshot snapshot() {
        final long durationMs;
        if (startTime == null) {
            durationMs = 0;
        } else {
            final var until = endTime != null ? endNanos : System.nanoTime();
            durationMs = (until - startNanos) / 1_000_000;
        }
        final var ok = successful.get();
        final var ko = failed.get();
        return StatisticsSnapshot.of(ok + ko, ok, ko, startTime, endTime, durationMs);
    }
}
