package com.example.neonomaly.metricstore.exception;

/**
 * The backing store cannot serve the request. Not retried by the store.
 */
public class StorageUnavailableException extends MetricStoreException {

    public StorageUnavailableException(String message) {
        super(message);
    }
}
