package com.mikov.emailvalidator.batch;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsSnapshotTest {

    @Test
    void derivedRatesAreZeroWithoutWork() {
        assertEquals(0.0, StatisticsSnapshot.EMPTY.successRate());
        assertEquals(0.0, StatisticsSnapshot.EMPTY.throughput());
    }

    @Test
    void derivedRates() {
        final var snapshot = StatisticsSnapshot.of(10, 8, 2, null, null, 2000);

        assertEquals(80.0, snapshot.successRate(), 0.001);
        assertEquals(5.0, snapshot.throughput(), 0.001);
    }

    @Test
    void mergeAddsCountersAndSpansWindow() {
        final var start = Instant.parse("2024-01-01T00:00:00Z");
        final var first = StatisticsSnapshot.of(4, 4, 0, start, start.plusMillis(500), 500);
        final var second = StatisticsSnapshot.of(6, 3, 3, start.plusMillis(100), start.plusMillis(1000), 900);

        final var merged = StatisticsSnapshot.merge(List.of(first, second));

        assertEquals(10, merged.processed());
        assertEquals(7, merged.successful());
        assertEquals(3, merged.failed());
        assertEquals(start, merged.startTime());
        assertEquals(start.plusMillis(1000), merged.endTime());
        assertEquals(1000, merged.durationMs());
        assertEquals(70.0, merged.successRate(), 0.001);
    }
}
