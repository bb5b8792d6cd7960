package com.example.neonomaly.anomalyservice.model;

import com.example.neonomaly.common.types.AnomalyReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnomalyDetectionResponseTest {

    @Test
    void roundsNumbersForDisplayOnly() {
        AnomalyReport report = AnomalyReport.builder()
                .timestamp(3_000L)
                .value(100.004)
                .windowMean(32.5)
                .windowStdDev(Math.sqrt(1518.75))
                .windowSize(4)
                .anomaly(true)
                .build();

        AnomalyDetectionResponse response = AnomalyDetectionResponse.from(report);

        assertEquals(Instant.ofEpochMilli(3_000L), response.getTimestamp());
        assertEquals(100.0, response.getValue());
        assertEquals(32.5, response.getWindowMean());
        assertEquals(38.97, response.getWindowStdDev());
        assertTrue(response.isAnomaly());
        assertEquals(Math.sqrt(1518.75), report.getWindowStdDev());
    }

    @Test
    void roundsHalfUp() {
        assertEquals(2.35, AnomalyDetectionResponse.round(2.345));
        assertEquals(-1.01, AnomalyDetectionResponse.round(-1.005));
        assertEquals(0.0, AnomalyDetectionResponse.round(0.004));
    }

    @Test
    void nonFiniteValuesPassThrough() {
        assertTrue(Double.isNaN(AnomalyDetectionResponse.round(Double.NaN)));
        assertEquals(Double.POSITIVE_INFINITY, AnomalyDetectionResponse.round(Double.POSITIVE_INFINITY));
    }
}
