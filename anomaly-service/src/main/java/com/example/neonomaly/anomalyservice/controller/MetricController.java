package com.example.neonomaly.anomalyservice.controller;

import com.example.neonomaly.anomalyservice.model.AnomalyDetectionRequest;
import com.example.neonomaly.anomalyservice.model.AnomalyDetectionResponse;
import com.example.neonomaly.anomalyservice.model.MetricCreateRequest;
import com.example.neonomaly.anomalyservice.model.MetricReadingRequest;
import com.example.neonomaly.anomalyservice.model.MetricResponse;
import com.example.neonomaly.metricstore.detection.AnomalyDetector;
import com.example.neonomaly.metricstore.registry.MetricRegistry;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/metrics")
public class MetricController {

    private final MetricRegistry metricRegistry;
    private final AnomalyDetector anomalyDetector;
    private final String ownerId;
    private final long defaultWindowSeconds;
    private final double defaultSigmaThreshold;

    public MetricController(MetricRegistry metricRegistry,
                            AnomalyDetector anomalyDetector,
                            @Value("${neonomaly.owner-id:1}") String ownerId,
                            @Value("${neonomaly.detection.default-window-seconds:600}") long defaultWindowSeconds,
                            @Value("${neonomaly.detection.default-sigma-threshold:3.0}") double defaultSigmaThreshold) {
        this.metricRegistry = metricRegistry;
        this.anomalyDetector = anomalyDetector;
        this.ownerId = ownerId;
        this.defaultWindowSeconds = defaultWindowSeconds;
        this.defaultSigmaThreshold = defaultSigmaThreshold;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<MetricResponse> createMetric(@Valid @RequestBody MetricCreateRequest request) {
        return Mono.fromCallable(() -> metricRegistry.register(
                        ownerId, request.getServiceId(), request.getName(), request.getDescription()))
                .map(MetricResponse::from);
    }

    @GetMapping("/service/{serviceId}")
    public Flux<MetricResponse> listMetrics(@PathVariable String serviceId) {
        return Flux.defer(() -> Flux.fromIterable(metricRegistry.list(ownerId, serviceId)))
                .map(MetricResponse::from);
    }

    @PostMapping("/{metricId}/readings")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Map<String, String>> addMetricReading(@PathVariable String metricId,
                                                      @Valid @RequestBody MetricReadingRequest request) {
        return Mono.fromCallable(() -> metricRegistry.appendReading(
                        ownerId, metricId, request.getValue(), toEpochMillis(request.getTimestamp())))
                .map(reading -> Map.of("message", "Metric reading added successfully"));
    }

    @PostMapping("/anomaly-detection")
    public Mono<AnomalyDetectionResponse> detectAnomaly(@Valid @RequestBody AnomalyDetectionRequest request) {
        long windowSeconds = request.getTimeWindowSeconds() != null ? request.getTimeWindowSeconds() : defaultWindowSeconds;
        double sigmaThreshold = request.getSigmaThreshold() != null ? request.getSigmaThreshold() : defaultSigmaThreshold;
        log.debug("Anomaly detection for {}/{} over {}s at {} sigma",
                request.getServiceId(), request.getMetricName(), windowSeconds, sigmaThreshold);

        return Mono.fromCallable(() -> anomalyDetector.detect(
                        ownerId, request.getServiceId(), request.getMetricName(), windowSeconds, sigmaThreshold))
                .map(AnomalyDetectionResponse::from);
    }

    private static Long toEpochMillis(Instant timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return timestamp.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("timestamp out of range: " + timestamp, e);
        }
    }
}
