package com.example.neonomaly.metricstore.exception;

/**
 * A referenced service or metric does not exist or is not visible to the caller.
 */
public class NotFoundException extends MetricStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException service(String serviceId) {
        return new NotFoundException("Service not found or you don't have access to it: " + serviceId);
    }

    public static NotFoundException metric(String metricId) {
        return new NotFoundException("Metric not found or you don't have access to it: " + metricId);
    }

    public static NotFoundException metricNamed(String serviceId, String metricName) {
        return new NotFoundException("Metric '" + metricName + "' not found for service " + serviceId);
    }
}
