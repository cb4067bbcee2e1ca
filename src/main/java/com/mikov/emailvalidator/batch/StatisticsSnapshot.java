package com.mikov.emailvalidator.batch;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a queue's statistics.
 *
 * @param durationMs   time between the first batch starting and the queue going idle
 * @param successRate  successful / processed × 100, 0 when nothing was processed
 * @param throughput   processed items per second, 0 when no time elapsed
 */
public record StatisticsSnapshot(long processed, long successful, long failed,
                                 Instant startTime, Instant endTime, long durationMs,
                                 double successRate, double throughput) {

    public static final StatisticsSnapshot EMPTY = of(0, 0, 0, null, null, 0);

    public static StatisticsSnapshot of(final long processed, final long successful, final long failed,
                                        final Instant startTime, final Instant endTime, final long durationMs) {
        final var successRate = processed == 0 ? 0.0 : successful * 100.0 / processed;
        final var throughput = durationMs <= 0 ? 0.0 : processed / (durationMs / 1000.0);
        return new StatisticsSnapshot(processed, successful, failed, startTime, endTime, durationMs,
                successRate, throughput);
    }

    /**
     * Combines the snapshots of queues that ran side by side: counters add up, the time
     * window spans the earliest start to the latest end.
     */
    public static StatisticsSnapshot merge(final List<StatisticsSnapshot> snapshots) {
        long processed = 0;
        long successful = 0;
        long failed = 0;
        Instant start = null;
        Instant end = null;
        for (final var snapshot : snapshots) {
            processed += snapshot.processed();
            successful += snapshot.successful();
            failed += snapshot.failed();
            if (snapshot.startTime() != null && (start == null || snapshot.startTime().isBefore(start))) {
                start = snapshot.startTime();
            }
            if (snapshot.endTime() != null && (end == null || snapshot.endTime().isAfter(end))) {
                end = snapshot.endTime();
            }
        }
        final var durationMs = snapshots.stream()
                .mapToLong(StatisticsSnapshot::durationMs)
                .max()
                .orElse(0);
        final var windowMs = start != null && end != null ? end.toEpochMilli() - start.toEpochMilli() : 0;
        return of(processed, successful, failed, start, end, Math.max(durationMs, windowMs));
    }
}
