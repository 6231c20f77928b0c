package com.scaniq.collector.entity;

import com.scaniq.collector.exception.CollectionException;

import java.util.concurrent.TimeoutException;

/**
 * Classified reason for a failed tool invocation.
 * Used for audit output and as a metrics tag.
 */
public enum ToolFailureReason {
    TIMEOUT("timeout", "Tool exceeded its time limit"),
    CONNECTION_REFUSED("connection_refused", "Connection refused by remote host"),
    DNS_RESOLUTION_FAILED("dns_resolution_failed", "DNS resolution failed"),
    SSL_HANDSHAKE_FAILED("ssl_handshake_failed", "TLS handshake failed"),
    HTTP_STATUS("http_status", "Remote host returned a non-2xx status"),
    SERVICE_UNAVAILABLE("service_unavailable", "Backing service not available"),
    EXTRACTION_FAILED("extraction_failed", "Content could not be parsed"),
    UNKNOWN_TOOL("unknown_tool", "No capability registered for tool"),
    UNKNOWN("unknown", "Unknown error occurred");

    private final String code;
    private final String description;

    ToolFailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Get failure reason from an exception raised by a capability.
     */
    public static ToolFailureReason fromException(Throwable e) {
        if (e == null) return UNKNOWN;
        if (e instanceof TimeoutException) return TIMEOUT;

        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        String className = e.getClass().getSimpleName().toLowerCase();

        if (e instanceof CollectionException ce) {
            switch (ce.getErrorCode()) {
                case "EXTRACTION_ERROR":
                    return EXTRACTION_FAILED;
                case "SERVICE_UNAVAILABLE":
                    return SERVICE_UNAVAILABLE;
                default:
                    break;
            }
            if (message.contains("status")) return HTTP_STATUS;
        }

        if (className.contains("timeout") || message.contains("timeout") || message.contains("timed out")) {
            return TIMEOUT;
        }
        if (message.contains("connection refused") || className.contains("connectexception")) {
            return CONNECTION_REFUSED;
        }
        if (className.contains("unknownhost") || message.contains("unknown host") || message.contains("unresolved")) {
            return DNS_RESOLUTION_FAILED;
        }
        if (className.contains("ssl") || message.contains("certificate") || message.contains("handshake")) {
            return SSL_HANDSHAKE_FAILED;
        }
        if (message.contains("status") || className.contains("httpstatus")) {
            return HTTP_STATUS;
        }

        Throwable cause = e.getCause();
        if (cause != null && cause != e) {
            return fromException(cause);
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
