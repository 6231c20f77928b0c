package com.scaniq.collector.service.audit;

import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.AuditSummary;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of every action taken during one collection run.
 * Safe for concurrent appends from parallel URL loops and search queries.
 */
@Slf4j
public class AuditTrail {

    public static final String ACTION_DECISION = "decision";

    private final String collectionId;
    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditTrail(String collectionId) {
        this.collectionId = collectionId;
    }

    /**
     * Stamps the entry with an id and timestamp, then appends it. Quality defaults to the
     * rating of its evidence count.
     */
    public AuditEntry log(AuditEntry.AuditEntryBuilder builder) {
        AuditEntry entry = builder
                .id(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .build();
        entries.add(entry);
        log.debug("[{}] {}/{} tool={} evidence={}", collectionId, entry.phase(), entry.action(),
                entry.tool(), entry.evidenceCount());
        return entry;
    }

    public List<AuditEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public AuditSummary summarize() {
        Map<String, Integer> byPhase = new LinkedHashMap<>();
        Map<String, Integer> byTool = new LinkedHashMap<>();
        int totalEvidence = 0;

        List<AuditEntry> snapshot = List.copyOf(entries);
        for (AuditEntry entry : snapshot) {
            totalEvidence += entry.evidenceCount();
            byPhase.merge(entry.phase(), entry.evidenceCount(), Integer::sum);
            if (entry.tool() != null) {
                byTool.merge(entry.tool(), entry.evidenceCount(), Integer::sum);
            }
        }

        List<AuditSummary.TimelineEntry> timeline = snapshot.stream()
                .map(e -> new AuditSummary.TimelineEntry(e.timestamp(), e.action(), e.evidenceCount()))
                .toList();

        return new AuditSummary(snapshot.size(), totalEvidence, byPhase, byTool, timeline);
    }

    /**
     * Number of decision entries per chosen tool.
     */
    public Map<String, Integer> decisionsByTool() {
        Map<String, Integer> decisions = new LinkedHashMap<>();
        for (AuditEntry entry : entries) {
            if (ACTION_DECISION.equals(entry.action()) && entry.tool() != null) {
                decisions.merge(entry.tool(), 1, Integer::sum);
            }
        }
        return decisions;
    }

    public String getCollectionId() {
        return collectionId;
    }
}
