package com.scaniq.collector.exception;

/**
 * Failure inside a collection capability.
 */
public class ToolExecutionException extends CollectionException {

    private final String tool;

    public ToolExecutionException(String tool, String message) {
        super("TOOL_ERROR", message);
        this.tool = tool;
    }

    public ToolExecutionException(String tool, String errorCode, String message) {
        super(errorCode, message);
        this.tool = tool;
    }

    public ToolExecutionException(String tool, String message, Throwable cause) {
        super("TOOL_ERROR", message, cause);
        this.tool = tool;
    }

    public static ToolExecutionException unavailable(String tool, String message) {
        return new ToolExecutionException(tool, "SERVICE_UNAVAILABLE", message);
    }

    public String getTool() {
        return tool;
    }
}
