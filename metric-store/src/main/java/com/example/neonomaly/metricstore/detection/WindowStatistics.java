package com.example.neonomaly.metricstore.detection;

import com.example.neonomaly.common.types.MetricReading;
import com.example.neonomaly.common.types.WindowStats;

import java.util.List;

public final class WindowStatistics {

    private WindowStatistics() {
    }

    /**
     * Mean and population standard deviation of the reading values, computed in two passes.
     * <p>
     * Values are divided by a power of two near the largest magnitude before summing, which
     * is exact, so windows of readings close to {@code Double.MAX_VALUE} stay finite.
     *
     * @throws IllegalArgumentException if {@code readings} is empty
     */
    public static WindowStats compute(List<MetricReading> readings) {
        if (readings == null || readings.isEmpty()) {
            throw new IllegalArgumentException("Statistics need at least one reading");
        }
        int count = readings.size();

        double largest = 0.0;
        for (MetricReading reading : readings) {
            largest = Math.max(largest, Math.abs(reading.getValue()));
        }
        double scale = scaleFor(largest);

        double sum = 0.0;
        for (MetricReading reading : readings) {
            sum += reading.getValue() / scale;
        }
        double mean = sum / count;

        double squaredDeviations = 0.0;
        for (MetricReading reading : readings) {
            double deviation = reading.getValue() / scale - mean;
            squaredDeviations += deviation * deviation;
        }

        return WindowStats.builder()
                .count(count)
                .mean(mean * scale)
                .stdDev(Math.sqrt(squaredDeviations / count) * scale)
                .build();
    }

    /**
     * Largest power of two not above {@code magnitude}, or 1 for zero and non-finite input.
     */
    static double scaleFor(double magnitude) {
        if (magnitude == 0.0 || !Double.isFinite(magnitude)) {
            return 1.0;
        }
        return Math.scalb(1.0, Math.getExponent(magnitude));
    }
}
