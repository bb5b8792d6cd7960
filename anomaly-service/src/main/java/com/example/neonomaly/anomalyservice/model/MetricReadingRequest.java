package com.example.neonomaly.anomalyservice.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

@Data
public class MetricReadingRequest {
    @NotNull
    private Double value;
    private Instant timestamp; // current time when absent
}
