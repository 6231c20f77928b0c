package com.scaniq.collector.exception;

/**
 * A collection request that cannot be run (missing domain or company name).
 */
public class InvalidCollectionRequestException extends CollectionException {

    public InvalidCollectionRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
