package com.example.neonomaly.metricstore.detection;

import com.example.neonomaly.common.types.MetricReading;

public final class AnomalyClassifier {

    private AnomalyClassifier() {
    }

    /**
     * A reading is anomalous when it deviates from the mean by strictly more than
     * {@code sigmaThreshold} standard deviations. With a zero standard deviation only an
     * exact match with the mean is normal.
     * <p>
     * Both sides are compared in units of a power of two near the largest operand, so the
     * outcome does not change when every operand is scaled by the same power of two.
     */
    public static boolean classify(MetricReading latest, double mean, double stdDev, double sigmaThreshold) {
        double largest = Math.max(Math.abs(latest.getValue()), Math.max(Math.abs(mean), Math.abs(stdDev)));
        double scale = WindowStatistics.scaleFor(largest);
        double deviation = Math.abs(latest.getValue() / scale - mean / scale);
        return deviation > sigmaThreshold * (stdDev / scale);
    }
}
