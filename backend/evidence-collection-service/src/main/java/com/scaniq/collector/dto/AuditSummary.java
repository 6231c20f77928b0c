package com.scaniq.collector.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view of an audit trail.
 */
public record AuditSummary(
        int totalActions,
        int totalEvidence,
        Map<String, Integer> evidenceByPhase,
        Map<String, Integer> evidenceByTool,
        List<TimelineEntry> timeline
) {
    public record TimelineEntry(Instant time, String action, int evidence) {}
}
