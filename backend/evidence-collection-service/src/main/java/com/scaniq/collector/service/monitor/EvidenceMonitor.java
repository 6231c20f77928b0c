package com.scaniq.collector.service.monitor;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.CoverageReport;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.Gap;
import com.scaniq.collector.entity.CollectionPhase;
import com.scaniq.collector.entity.EvidenceCategory;
import com.scaniq.collector.entity.GapPriority;
import com.scaniq.collector.service.CollectionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Measures collected evidence against per-category targets.
 * Stateless: every call recomputes gaps from the evidence it is given.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceMonitor {

    private final EvidenceCollectionConfig config;

    public Map<String, Integer> countByCategory(Collection<EvidenceItem> evidence) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (EvidenceItem item : evidence) {
            counts.merge(item.category(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Gaps for every tracked category under target, plus HIGH gaps for required categories
     * holding fewer than the required minimum. Sorted HIGH, MEDIUM, LOW; ties keep target order.
     */
    public List<Gap> analyzeGaps(Collection<EvidenceItem> evidence, List<String> requiredCategories) {
        EvidenceCollectionConfig.Monitor monitor = config.getMonitor();
        Map<String, Integer> counts = countByCategory(evidence);

        Map<String, Gap> gaps = new LinkedHashMap<>();
        monitor.getTargets().forEach((category, target) -> {
            int current = counts.getOrDefault(category, 0);
            if (current < target) {
                int importance = monitor.getImportance().getOrDefault(category, 1);
                gaps.put(category, Gap.of(category, current, target, importance));
            }
        });

        for (String category : requiredCategories) {
            int current = counts.getOrDefault(category, 0);
            if (current < monitor.getRequiredMinimum()) {
                gaps.put(category, Gap.required(category, current, monitor.getRequiredTarget()));
            }
        }

        List<Gap> sorted = new ArrayList<>(gaps.values());
        sorted.sort(Comparator.comparing(Gap::priority));
        return sorted;
    }

    /**
     * Analyzes the run's evidence and records the pass in its audit trail.
     */
    public List<Gap> analyzeGaps(CollectionContext context) {
        long start = System.currentTimeMillis();
        List<String> required = context.getThesis() != null
                ? context.getThesis().getRequiredCategories()
                : List.of();
        List<Gap> gaps = analyzeGaps(context.getEvidenceStore().all(), required);

        context.getAuditTrail().log(AuditEntry.builder()
                .phase(CollectionPhase.GAP_ANALYSIS.getCode())
                .action("analyze-gaps")
                .input(Map.of("evidence", context.getEvidenceStore().size(), "required", required))
                .output(Map.of("gaps", gaps.stream().map(Gap::category).toList(),
                        "highPriority", gaps.stream().filter(g -> g.priority() == GapPriority.HIGH).count()))
                .reasoning("Compare collected evidence with category targets")
                .durationMs(System.currentTimeMillis() - start));

        log.info("[{}] Gap analysis: {} gaps ({})", context.getCollectionId(), gaps.size(),
                gaps.stream().map(g -> g.category() + "=" + g.priority()).collect(Collectors.joining(", ")));
        return gaps;
    }

    public CoverageReport coverage(Collection<EvidenceItem> evidence) {
        Map<String, Integer> counts = countByCategory(evidence);
        List<String> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Arrays.stream(EvidenceCategory.values())
                .filter(EvidenceCategory.COVERAGE_SET::contains)
                .map(EvidenceCategory::getTag)
                .forEach(tag -> (counts.getOrDefault(tag, 0) > 0 ? found : missing).add(tag));

        int percentage = Math.round(100f * found.size() / EvidenceCategory.COVERAGE_SET.size());
        return new CoverageReport(percentage, found, missing);
    }
}
