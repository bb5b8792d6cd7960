package com.example.neonomaly.metricstore;

import com.example.neonomaly.common.types.MetricReading;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the trailing time window of a metric by walking its chain backward from the
 * latest reading.
 * <p>
 * The walk follows insertion order and stops at the first reading older than the cutoff, so
 * backfilled readings (older timestamps appended later) can hide or expose readings relative
 * to true chronological order.
 */
public class WindowReconstructor {

    private final ReadingStore store;

    public WindowReconstructor(ReadingStore store) {
        this.store = store;
    }

    /**
     * Returns the readings of the window, newest first. The latest reading is always the
     * first element; an empty list means the metric has no readings at all.
     */
    public List<MetricReading> window(String metricId, long windowSeconds) {
        ReadingChain chain = store.chain(metricId);
        Optional<ReadingNode> latest = chain.latest();
        if (latest.isEmpty()) {
            return List.of();
        }

        ReadingNode node = latest.get();
        long cutoff = cutoff(node.reading().getTimestamp(), windowSeconds);

        List<MetricReading> readings = new ArrayList<>();
        readings.add(node.reading());
        Optional<ReadingNode> cursor = chain.predecessor(node);
        while (cursor.isPresent() && cursor.get().reading().getTimestamp() >= cutoff) {
            readings.add(cursor.get().reading());
            cursor = chain.predecessor(cursor.get());
        }
        return readings;
    }

    // Saturates instead of wrapping for very large windows in either direction.
    static long cutoff(long latestTimestamp, long windowSeconds) {
        try {
            return Math.subtractExact(latestTimestamp, Math.multiplyExact(windowSeconds, 1000L));
        } catch (ArithmeticException overflow) {
            return windowSeconds > 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
