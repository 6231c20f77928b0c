package com.scaniq.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of a collection run. On failure {@code error} is set and the evidence and audit
 * gathered before the failure are still returned.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CollectionResult(
        String collectionId,
        boolean success,
        String error,
        List<EvidenceItem> evidence,
        List<AuditEntry> auditTrail,
        CollectionSummary summary
) {
    public CollectionResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }
}
