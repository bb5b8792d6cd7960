package com.example.neonomaly.metricstore;

import com.example.neonomaly.common.types.MetricReading;
import com.example.neonomaly.metricstore.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowReconstructorTest {

    private InMemoryReadingStore store;
    private WindowReconstructor reconstructor;

    @BeforeEach
    void setUp() {
        store = new InMemoryReadingStore(Clock.systemUTC());
        store.createChain("latency");
        reconstructor = new WindowReconstructor(store);
    }

    @Test
    void metricWithoutReadingsHasEmptyWindow() {
        assertTrue(reconstructor.window("latency", 600).isEmpty());
    }

    @Test
    void unknownMetricIsNotFound() {
        assertThrows(NotFoundException.class, () -> reconstructor.window("missing", 600));
    }

    @Test
    void windowIsNewestFirstSuffixWithinCutoff() {
        for (long t = 0; t <= 10_000; t += 1_000) {
            store.append("latency", t / 1_000.0, t);
        }

        List<MetricReading> window = reconstructor.window("latency", 3);

        assertEquals(List.of(10_000L, 9_000L, 8_000L, 7_000L), timestamps(window));
    }

    @Test
    void cutoffIsInclusive() {
        store.append("latency", 1.0, 4_000L);
        store.append("latency", 2.0, 5_000L);
        store.append("latency", 3.0, 6_000L);

        assertEquals(List.of(6_000L, 5_000L, 4_000L), timestamps(reconstructor.window("latency", 2)));
    }

    @Test
    void windowGrowsMonotonicallyWithWidth() {
        for (long t = 0; t <= 20_000; t += 500) {
            store.append("latency", 1.0, t);
        }

        int previous = 0;
        for (long seconds = 0; seconds <= 25; seconds++) {
            int size = reconstructor.window("latency", seconds).size();
            assertTrue(size >= previous, "window shrank at " + seconds + "s");
            previous = size;
        }
        assertEquals(41, previous);
    }

    @Test
    void zeroWindowHoldsOnlyLatestUnlessTimestampsTie() {
        store.append("latency", 1.0, 1_000L);
        store.append("latency", 2.0, 2_000L);

        assertEquals(List.of(2_000L), timestamps(reconstructor.window("latency", 0)));

        store.append("latency", 3.0, 2_000L);
        assertEquals(List.of(2_000L, 2_000L), timestamps(reconstructor.window("latency", 0)));
    }

    @Test
    void negativeWindowStillIncludesLatest() {
        store.append("latency", 1.0, 1_000L);
        store.append("latency", 2.0, 2_000L);

        List<MetricReading> window = reconstructor.window("latency", -60);

        assertEquals(1, window.size());
        assertEquals(2.0, window.get(0).getValue());
    }

    @Test
    void walkStopsAtFirstReadingOutsideWindowInInsertionOrder() {
        store.append("latency", 1.0, 10_000L);
        store.append("latency", 2.0, 1_000L); // backfilled
        store.append("latency", 3.0, 11_000L);

        // 10_000 lies inside the window but sits behind the backfilled reading
        assertEquals(List.of(11_000L), timestamps(reconstructor.window("latency", 5)));
    }

    @Test
    void cutoffSaturatesOnOverflow() {
        assertEquals(Long.MIN_VALUE, WindowReconstructor.cutoff(0L, Long.MAX_VALUE));
        assertEquals(Long.MAX_VALUE, WindowReconstructor.cutoff(0L, Long.MIN_VALUE));
        assertEquals(-600_000L, WindowReconstructor.cutoff(0L, 600));
    }

    @Test
    void hugeWindowCoversWholeHistory() {
        store.append("latency", 1.0, Long.MIN_VALUE + 1);
        store.append("latency", 2.0, 0L);

        assertEquals(2, reconstructor.window("latency", Long.MAX_VALUE).size());
    }

    private static List<Long> timestamps(List<MetricReading> readings) {
        return readings.stream().map(MetricReading::getTimestamp).collect(Collectors.toList());
    }
}
