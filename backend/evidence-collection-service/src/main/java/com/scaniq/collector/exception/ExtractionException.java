package com.scaniq.collector.exception;

/**
 * Parse or pattern failure while extracting evidence from fetched content.
 */
public class ExtractionException extends CollectionException {

    public ExtractionException(String message, Throwable cause) {
        super("EXTRACTION_ERROR", message, cause);
    }
}
