package com.scaniq.collector.dto;

import com.scaniq.collector.entity.AuditQuality;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One recorded action of a collection run. Entries are immutable once appended.
 */
@Builder(toBuilder = true)
public record AuditEntry(
        String id,
        Instant timestamp,
        String phase,
        String action,
        String tool,
        Map<String, Object> input,
        Map<String, Object> output,
        String reasoning,
        int evidenceCount,
        AuditQuality quality,
        long durationMs
) {
    public AuditEntry {
        if (evidenceCount < 0) {
            throw new IllegalArgumentException("evidenceCount must not be negative");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative");
        }
        input = withoutNulls(input);
        output = withoutNulls(output);
        quality = quality == null ? AuditQuality.fromEvidenceCount(evidenceCount) : quality;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> values) {
        if (values == null || values.isEmpty()) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return Collections.unmodifiableMap(copy);
    }
}
