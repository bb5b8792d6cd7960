package com.example.neonomaly.metricstore.detection;

import com.example.neonomaly.common.types.AnomalyReport;
import com.example.neonomaly.common.types.Metric;
import com.example.neonomaly.common.types.MetricReading;
import com.example.neonomaly.common.types.WindowStats;
import com.example.neonomaly.metricstore.WindowReconstructor;
import com.example.neonomaly.metricstore.exception.NoDataException;
import com.example.neonomaly.metricstore.exception.NotFoundException;
import com.example.neonomaly.metricstore.registry.MetricRegistry;
import com.example.neonomaly.metricstore.registry.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Classifies the latest reading of a metric against the trailing window behind it.
 * Each call reads one snapshot of the chain and never writes.
 */
@Slf4j
public class AnomalyDetector {

    private final ServiceRegistry serviceRegistry;
    private final MetricRegistry metricRegistry;
    private final WindowReconstructor windowReconstructor;

    public AnomalyDetector(ServiceRegistry serviceRegistry,
                           MetricRegistry metricRegistry,
                           WindowReconstructor windowReconstructor) {
        this.serviceRegistry = serviceRegistry;
        this.metricRegistry = metricRegistry;
        this.windowReconstructor = windowReconstructor;
    }

    public AnomalyReport detect(String ownerId, String serviceId, String metricName,
                                long windowSeconds, double sigmaThreshold) {
        serviceRegistry.get(ownerId, serviceId);
        Metric metric = metricRegistry.findByName(serviceId, metricName)
                .orElseThrow(() -> NotFoundException.metricNamed(serviceId, metricName));

        List<MetricReading> window = windowReconstructor.window(metric.getId(), windowSeconds);
        if (window.isEmpty()) {
            throw new NoDataException(metric.getId());
        }

        MetricReading latest = window.get(0);
        WindowStats stats = WindowStatistics.compute(window);
        boolean anomaly = AnomalyClassifier.classify(latest, stats.getMean(), stats.getStdDev(), sigmaThreshold);

        if (anomaly) {
            log.info("Anomaly on {}/{}: value {} vs mean {} stddev {} over {} readings",
                    serviceId, metricName, latest.getValue(), stats.getMean(), stats.getStdDev(), stats.getCount());
        } else {
            log.debug("No anomaly on {}/{} over {} readings", serviceId, metricName, stats.getCount());
        }

        return AnomalyReport.builder()
                .serviceId(serviceId)
                .metricId(metric.getId())
                .timestamp(latest.getTimestamp())
                .value(latest.getValue())
                .windowMean(stats.getMean())
                .windowStdDev(stats.getStdDev())
                .windowSize(stats.getCount())
                .anomaly(anomaly)
                .build();
    }
}
