package com.scaniq.collector.exception;

/**
 * Malformed evidence encountered while deduplicating or scoring.
 */
public class AggregationException extends CollectionException {

    public AggregationException(String message) {
        super("AGGREGATION_ERROR", message);
    }

    public AggregationException(String message, Throwable cause) {
        super("AGGREGATION_ERROR", message, cause);
    }
}
