package com.example.neonomaly.common.types;

import lombok.Builder;
import lombok.Value;

// A named time series under a Service, e.g. "cpu.utilization"
@Value
@Builder
public class Metric {
    String id;
    String name; // unique within the owning service
    String description;
    String serviceId;
}
