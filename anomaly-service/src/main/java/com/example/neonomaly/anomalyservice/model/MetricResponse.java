package com.example.neonomaly.anomalyservice.model;

import com.example.neonomaly.common.types.Metric;
import com.example.neonomaly.common.types.MetricSummary;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MetricResponse {
    String id;
    String name;
    String description;
    String serviceId;
    MetricReadingResponse latestReading;

    public static MetricResponse from(Metric metric) {
        return builderFor(metric).build();
    }

    public static MetricResponse from(MetricSummary summary) {
        return builderFor(summary.getMetric())
                .latestReading(summary.latest().map(MetricReadingResponse::from).orElse(null))
                .build();
    }

    private static MetricResponseBuilder builderFor(Metric metric) {
        return MetricResponse.builder()
                .id(metric.getId())
                .name(metric.getName())
                .description(metric.getDescription())
                .serviceId(metric.getServiceId());
    }
}
