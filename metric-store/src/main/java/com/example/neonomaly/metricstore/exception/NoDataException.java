package com.example.neonomaly.metricstore.exception;

/**
 * The metric exists but has nothing to analyze yet.
 */
public class NoDataException extends MetricStoreException {

    public NoDataException(String metricId) {
        super("No data found for metric " + metricId);
    }
}
