package com.example.neonomaly.metricstore.registry;

import com.example.neonomaly.common.types.Metric;
import com.example.neonomaly.common.types.MetricReading;
import com.example.neonomaly.common.types.MetricSummary;
import com.example.neonomaly.metricstore.ReadingStore;
import com.example.neonomaly.metricstore.exception.ConflictException;
import com.example.neonomaly.metricstore.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics of each service, in registration order, and the owner-scoped entry point for
 * appending readings to them.
 */
@Slf4j
public class MetricRegistry {

    private final ServiceRegistry serviceRegistry;
    private final ReadingStore readingStore;

    private final ConcurrentHashMap<String, Metric> metricsById = new ConcurrentHashMap<>();
    // serviceId -> metric name -> metric; a LinkedHashMap keeps registration order
    private final ConcurrentHashMap<String, Map<String, Metric>> metricsByService = new ConcurrentHashMap<>();

    public MetricRegistry(ServiceRegistry serviceRegistry, ReadingStore readingStore) {
        this.serviceRegistry = serviceRegistry;
        this.readingStore = readingStore;
    }

    public Metric register(String ownerId, String serviceId, String name, String description) {
        Names.requireValid(name, "Metric");
        serviceRegistry.get(ownerId, serviceId);
        Map<String, Metric> metrics = metricsByService.computeIfAbsent(serviceId, id -> new LinkedHashMap<>());

        synchronized (metrics) {
            if (metrics.containsKey(name)) {
                throw new ConflictException("Metric with this name already exists for this service: " + name);
            }
            Metric metric = Metric.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .description(description != null ? description : "")
                    .serviceId(serviceId)
                    .build();
            readingStore.createChain(metric.getId());
            metrics.put(name, metric);
            metricsById.put(metric.getId(), metric);

            log.info("Registered metric {} ({}) under service {}", name, metric.getId(), serviceId);
            return metric;
        }
    }

    /**
     * Metrics of the service in registration order, each with its latest reading if any.
     */
    public List<MetricSummary> list(String ownerId, String serviceId) {
        serviceRegistry.get(ownerId, serviceId);
        Map<String, Metric> metrics = metricsByService.get(serviceId);
        if (metrics == null) {
            return List.of();
        }
        List<Metric> snapshot;
        synchronized (metrics) {
            snapshot = new ArrayList<>(metrics.values());
        }

        List<MetricSummary> summaries = new ArrayList<>(snapshot.size());
        for (Metric metric : snapshot) {
            summaries.add(MetricSummary.builder()
                    .metric(metric)
                    .latestReading(readingStore.latest(metric.getId()).orElse(null))
                    .build());
        }
        return summaries;
    }

    public Metric get(String ownerId, String metricId) {
        Metric metric = metricsById.get(metricId);
        if (metric == null || serviceRegistry.find(ownerId, metric.getServiceId()).isEmpty()) {
            throw NotFoundException.metric(metricId);
        }
        return metric;
    }

    public Optional<Metric> findByName(String serviceId, String name) {
        Map<String, Metric> metrics = metricsByService.get(serviceId);
        if (metrics == null) {
            return Optional.empty();
        }
        synchronized (metrics) {
            return Optional.ofNullable(metrics.get(name));
        }
    }

    public MetricReading appendReading(String ownerId, String metricId, double value, Long timestamp) {
        Metric metric = get(ownerId, metricId);
        return readingStore.append(metric.getId(), value, timestamp);
    }
}
