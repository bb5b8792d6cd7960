package com.example.neonomaly.anomalyservice.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AnomalyDetectionRequest {
    @NotBlank
    private String serviceId;
    @NotBlank
    private String metricName;
    // Configured defaults apply when absent
    private Long timeWindowSeconds;
    private Double sigmaThreshold;
}
