package com.example.neonomaly.common.types;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

// A metric as listed under its service, with the newest reading when there is one
@Value
@Builder
public class MetricSummary {
    Metric metric;
    MetricReading latestReading;

    public Optional<MetricReading> latest() {
        return Optional.ofNullable(latestReading);
    }
}
