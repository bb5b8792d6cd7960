package com.example.neonomaly.metricstore.detection;

import com.example.neonomaly.common.types.MetricReading;
import com.example.neonomaly.common.types.WindowStats;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WindowStatisticsTest {

    @Test
    void singleValueHasZeroDeviation() {
        for (double v : new double[]{0.0, -17.25, 1e12, Double.MIN_VALUE}) {
            WindowStats stats = WindowStatistics.compute(readings(v));

            assertEquals(v, stats.getMean());
            assertEquals(0.0, stats.getStdDev());
            assertEquals(1, stats.getCount());
        }
    }

    @Test
    void usesPopulationStandardDeviation() {
        WindowStats stats = WindowStatistics.compute(readings(2, 4, 4, 4, 5, 5, 7, 9));

        assertEquals(5.0, stats.getMean());
        assertEquals(2.0, stats.getStdDev());
    }

    @Test
    void skewedWindow() {
        WindowStats stats = WindowStatistics.compute(readings(100, 10, 10, 10));

        assertEquals(32.5, stats.getMean());
        assertEquals(Math.sqrt(1518.75), stats.getStdDev(), 1e-12);
    }

    @Test
    void largeOffsetDoesNotLosePrecision() {
        WindowStats stats = WindowStatistics.compute(readings(1e9 + 4, 1e9 + 7, 1e9 + 13, 1e9 + 16));

        assertEquals(1e9 + 10, stats.getMean());
        assertEquals(Math.sqrt(22.5), stats.getStdDev(), 1e-6);
    }

    @Test
    void valuesNearMaxDoubleStayFinite() {
        WindowStats equal = WindowStatistics.compute(readings(1e308, 1e308));

        assertEquals(1e308, equal.getMean());
        assertEquals(0.0, equal.getStdDev());

        WindowStats spread = WindowStatistics.compute(readings(Double.MAX_VALUE, -Double.MAX_VALUE));

        assertEquals(0.0, spread.getMean());
        assertEquals(Double.MAX_VALUE, spread.getStdDev());
    }

    @Test
    void scalingByPowerOfTwoScalesResultExactly() {
        WindowStats small = WindowStatistics.compute(readings(1, 2, 3, 10));
        double factor = Math.scalb(1.0, 1000);
        WindowStats large = WindowStatistics.compute(readings(factor, 2 * factor, 3 * factor, 10 * factor));

        assertEquals(small.getMean() * factor, large.getMean());
        assertEquals(small.getStdDev() * factor, large.getStdDev());
    }

    @Test
    void allZeroWindow() {
        WindowStats stats = WindowStatistics.compute(readings(0, 0, 0));

        assertEquals(0.0, stats.getMean());
        assertEquals(0.0, stats.getStdDev());
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> WindowStatistics.compute(List.of()));
    }

    private static List<MetricReading> readings(double... values) {
        return DoubleStream.of(values)
                .mapToObj(v -> MetricReading.builder().id("r").value(v).timestamp(0L).build())
                .collect(Collectors.toList());
    }
}
