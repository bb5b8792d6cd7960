package com.example.neonomaly.metricstore;

import com.example.neonomaly.common.types.MetricReading;
import com.example.neonomaly.metricstore.exception.NotFoundException;
import com.example.neonomaly.metricstore.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryReadingStore implements ReadingStore, AutoCloseable {

    // metricId -> chain; history is never evicted
    private final ConcurrentHashMap<String, ReadingChain> chains = new ConcurrentHashMap<>();
    private final Clock clock;

    private volatile boolean closed;

    public InMemoryReadingStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void createChain(String metricId) {
        ensureOpen();
        chains.putIfAbsent(metricId, new ReadingChain(metricId));
    }

    @Override
    public MetricReading append(String metricId, double value, Long timestamp) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Reading value must be finite: " + value);
        }
        ensureOpen();
        ReadingChain chain = chain(metricId);

        MetricReading reading = MetricReading.builder()
                .id(UUID.randomUUID().toString())
                .value(value)
                .timestamp(timestamp != null ? timestamp : clock.millis())
                .build();
        ReadingNode node = chain.append(reading);

        log.debug("Appended reading {} to metric {} (chain size {})", reading.getId(), chain.getMetricId(), chain.size());
        return node.reading();
    }

    @Override
    public ReadingChain chain(String metricId) {
        ensureOpen();
        ReadingChain chain = chains.get(metricId);
        if (chain == null) {
            throw NotFoundException.metric(metricId);
        }
        return chain;
    }

    @Override
    public Optional<MetricReading> latest(String metricId) {
        return chain(metricId).latest().map(ReadingNode::reading);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("Reading store closed with {} metric chains", chains.size());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageUnavailableException("Reading store is closed");
        }
    }
}
