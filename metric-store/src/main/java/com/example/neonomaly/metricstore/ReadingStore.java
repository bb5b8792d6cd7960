package com.example.neonomaly.metricstore;

import com.example.neonomaly.common.types.MetricReading;

import java.util.Optional;

/**
 * Owns one {@link ReadingChain} per metric and is the only writer to them.
 */
public interface ReadingStore {

    /**
     * Creates the empty chain for a newly registered metric. A no-op if the chain exists.
     */
    void createChain(String metricId);

    /**
     * Appends a reading to the metric's chain.
     *
     * @param timestamp UTC milliseconds, or {@code null} for the current time
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     * @throws com.example.neonomaly.metricstore.exception.NotFoundException if the metric has no chain
     * @throws com.example.neonomaly.metricstore.exception.StorageUnavailableException if the store cannot commit
     */
    MetricReading append(String metricId, double value, Long timestamp);

    /**
     * @throws com.example.neonomaly.metricstore.exception.NotFoundException if the metric has no chain
     */
    ReadingChain chain(String metricId);

    Optional<MetricReading> latest(String metricId);
}
