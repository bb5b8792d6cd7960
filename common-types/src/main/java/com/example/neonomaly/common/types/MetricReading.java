package com.example.neonomaly.common.types;

import lombok.Builder;
import lombok.Value;

// A single immutable sample of a metric
@Value
@Builder
public class MetricReading {
    String id;
    double value;
    long timestamp; // UTC milliseconds
}
