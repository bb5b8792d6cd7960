package com.example.neonomaly.metricstore;

import com.example.neonomaly.common.types.MetricReading;

import java.util.Objects;
import java.util.Optional;

/**
 * One link of a {@link ReadingChain}. The reading and the backward link are fixed at
 * construction; the forward link is written once, when the next reading is appended.
 */
public final class ReadingNode {

    private final MetricReading reading;
    private final ReadingNode previous;
    private volatile ReadingNode next;

    ReadingNode(MetricReading reading, ReadingNode previous) {
        this.reading = Objects.requireNonNull(reading, "reading");
        this.previous = previous;
    }

    public MetricReading reading() {
        return reading;
    }

    Optional<ReadingNode> previous() {
        return Optional.ofNullable(previous);
    }

    Optional<ReadingNode> next() {
        return Optional.ofNullable(next);
    }

    void linkNext(ReadingNode successor) {
        if (next != null) {
            throw new IllegalStateException("Reading " + reading.getId() + " already has a successor");
        }
        next = successor;
    }
}
