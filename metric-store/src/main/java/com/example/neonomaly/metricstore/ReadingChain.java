package com.example.neonomaly.metricstore;

import com.example.neonomaly.common.types.MetricReading;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reverse-insertion-ordered chain of readings for a single metric.
 * <p>
 * Appends are serialized by a lock private to this chain, so appends to different metrics
 * never contend. Readers never take the lock: {@code latest} is volatile and every node's
 * backward link is final, so a reader that has seen a node sees the whole suffix behind it.
 */
public class ReadingChain {

    private final String metricId;
    private final ReentrantLock appendLock = new ReentrantLock();

    private volatile ReadingNode latest;
    private volatile long size;

    public ReadingChain(String metricId) {
        this.metricId = metricId;
    }

    public String getMetricId() {
        return metricId;
    }

    public Optional<ReadingNode> latest() {
        return Optional.ofNullable(latest);
    }

    public Optional<ReadingNode> predecessor(ReadingNode node) {
        return node.previous();
    }

    public Optional<ReadingNode> successor(ReadingNode node) {
        return node.next();
    }

    public long size() {
        return size;
    }

    /**
     * Links {@code reading} in as the new latest node. The old latest, if any, becomes its
     * predecessor and gets its forward link set to the new node.
     */
    ReadingNode append(MetricReading reading) {
        appendLock.lock();
        try {
            ReadingNode old = latest;
            ReadingNode node = new ReadingNode(reading, old);
            if (old != null) {
                old.linkNext(node);
            }
            latest = node;
            size = size + 1;
            return node;
        } finally {
            appendLock.unlock();
        }
    }
}
