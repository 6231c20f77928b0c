package com.scaniq.collector.exception;

/**
 * Network failure, timeout or non-2xx response while fetching a page.
 */
public class FetchException extends CollectionException {

    private final String url;
    private final int statusCode;

    public FetchException(String url, String message, Throwable cause) {
        super("FETCH_ERROR", message, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public FetchException(String url, int statusCode) {
        super("FETCH_ERROR", "Unexpected status " + statusCode + " for " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
