package com.scaniq.collector.dto;

import com.scaniq.collector.entity.OverallQuality;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionSummary {

    private int totalActions;
    private int totalRawEvidence;
    private int totalEvidence;
    private Map<String, Integer> evidenceByPhase;
    private Map<String, Integer> evidenceByTool;
    private Map<String, Integer> decisionsByTool;
    private int urlsDiscovered;
    private int urlsProcessed;
    private int coveragePercentage;
    private List<String> foundCategories;
    private List<String> missingCategories;
    private List<Gap> gaps;
    private OverallQuality overallQuality;
    private List<AuditSummary.TimelineEntry> timeline;
    private long durationMs;
}
