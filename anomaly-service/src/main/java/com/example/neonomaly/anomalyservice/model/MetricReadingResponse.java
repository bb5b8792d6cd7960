package com.example.neonomaly.anomalyservice.model;

import com.example.neonomaly.common.types.MetricReading;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MetricReadingResponse {
    String id;
    double value;
    Instant timestamp;

    public static MetricReadingResponse from(MetricReading reading) {
        return MetricReadingResponse.builder()
                .id(reading.getId())
                .value(reading.getValue())
                .timestamp(Instant.ofEpochMilli(reading.getTimestamp()))
                .build();
    }
}
