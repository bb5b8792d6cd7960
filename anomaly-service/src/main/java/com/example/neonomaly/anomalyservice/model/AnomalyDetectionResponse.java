package com.example.neonomaly.anomalyservice.model;

import com.example.neonomaly.common.types.AnomalyReport;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

@Value
@Builder
public class AnomalyDetectionResponse {
    Instant timestamp;
    double value;
    double windowMean;
    double windowStdDev;
    @JsonProperty("is_anomaly")
    boolean anomaly;

    // Numbers are rounded for display only; the report keeps full precision.
    public static AnomalyDetectionResponse from(AnomalyReport report) {
        return AnomalyDetectionResponse.builder()
                .timestamp(Instant.ofEpochMilli(report.getTimestamp()))
                .value(round(report.getValue()))
                .windowMean(round(report.getWindowMean()))
                .windowStdDev(round(report.getWindowStdDev()))
                .anomaly(report.isAnomaly())
                .build();
    }

    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
