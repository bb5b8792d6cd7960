package com.example.neonomaly.metricstore.exception;

/**
 * A name is already taken within its scope.
 */
public class ConflictException extends MetricStoreException {

    public ConflictException(String message) {
        super(message);
    }
}
