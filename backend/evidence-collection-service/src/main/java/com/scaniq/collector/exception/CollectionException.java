package com.scaniq.collector.exception;

/**
 * Base class for evidence collection failures.
 */
public class CollectionException extends RuntimeException {

    private final String errorCode;

    public CollectionException(String message) {
        super(message);
        this.errorCode = "COLLECTION_ERROR";
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "COLLECTION_ERROR";
    }

    public CollectionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CollectionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
