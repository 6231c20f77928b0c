package com.scaniq.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.entity.ToolFailureReason;

import java.util.List;
import java.util.Map;

/**
 * Outcome of running one capability against one URL.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        CollectionTool tool,
        boolean success,
        List<EvidenceItem> evidence,
        Map<String, Object> characteristics,
        long durationMs,
        String error,
        ToolFailureReason failureReason
) {
    public ToolResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        characteristics = characteristics == null ? Map.of() : Map.copyOf(characteristics);
    }

    public static ToolResult success(CollectionTool tool, List<EvidenceItem> evidence,
                                     Map<String, Object> characteristics, long durationMs) {
        return new ToolResult(tool, true, evidence, characteristics, durationMs, null, null);
    }

    public static ToolResult failure(CollectionTool tool, String error, ToolFailureReason reason, long durationMs) {
        return new ToolResult(tool, false, List.of(), Map.of(), durationMs, error, reason);
    }
}
