package com.example.neonomaly.common.types;

import lombok.Builder;
import lombok.Value;

// Outcome of classifying the latest reading of a metric against its trailing window
@Value
@Builder
public class AnomalyReport {
    String serviceId;
    String metricId;
    long timestamp;  // of the latest reading, UTC milliseconds
    double value;    // of the latest reading
    double windowMean;
    double windowStdDev;
    long windowSize;
    boolean anomaly;
}
