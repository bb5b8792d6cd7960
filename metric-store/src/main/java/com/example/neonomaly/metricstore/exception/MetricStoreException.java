package com.example.neonomaly.metricstore.exception;

/**
 * Root of the typed outcomes the store reports to its callers.
 */
public abstract class MetricStoreException extends RuntimeException {

    protected MetricStoreException(String message) {
        super(message);
    }
}
