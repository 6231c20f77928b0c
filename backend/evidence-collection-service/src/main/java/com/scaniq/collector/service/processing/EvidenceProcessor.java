package com.scaniq.collector.service.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.entity.OverallQuality;
import com.scaniq.collector.exception.AggregationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Deduplicates, scores and ranks raw evidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceProcessor {

    private static final double HIGH_SCORE = 0.8;

    private final EvidenceCollectionConfig config;
    private final ObjectMapper objectMapper;

    /**
     * One item per distinct value; the most confident item wins, the earliest on ties.
     * Items whose value cannot be keyed are dropped.
     */
    public List<EvidenceItem> dedupe(List<EvidenceItem> items) {
        Map<String, EvidenceItem> unique = new LinkedHashMap<>();
        int dropped = 0;
        for (EvidenceItem item : items) {
            String key;
            try {
                key = contentKey(item);
            } catch (AggregationException e) {
                dropped++;
                log.warn("Dropping malformed evidence {} ({}): {}", item.id(), item.type(), e.getMessage());
                continue;
            }
            unique.merge(key, item, (kept, candidate) ->
                    candidate.confidence() > kept.confidence() ? candidate : kept);
        }
        if (dropped > 0) {
            log.warn("Dropped {} malformed evidence items during deduplication", dropped);
        }
        return new ArrayList<>(unique.values());
    }

    public List<EvidenceItem> process(List<EvidenceItem> items) {
        double boost = config.getProcessing().getHighValueBoost();
        List<String> highValue = config.getProcessing().getHighValueCategories();

        List<EvidenceItem> scored = new ArrayList<>();
        for (EvidenceItem item : dedupe(items)) {
            double factor = highValue.contains(item.category()) ? boost : 1.0;
            scored.add(item.withScore(Math.min(item.confidence() * factor, 1.0)));
        }
        scored.sort(Comparator.comparingDouble(EvidenceItem::score).reversed());

        log.debug("Processed {} raw items into {} scored items", items.size(), scored.size());
        return scored;
    }

    public OverallQuality rateQuality(List<EvidenceItem> processed) {
        long highScoring = processed.stream()
                .filter(item -> item.score() != null && item.score() > HIGH_SCORE)
                .count();
        return OverallQuality.rate(processed.size(), highScoring);
    }

    /**
     * Canonical JSON of the value, with object fields in name order.
     */
    String contentKey(EvidenceItem item) {
        JsonNode value = item.value();
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new AggregationException("Evidence " + item.id() + " has no value");
        }
        return canonical(value).toString();
    }

    private JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = objectMapper.createObjectNode();
            TreeSet<String> names = new TreeSet<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            for (String name : names) {
                sorted.set(name, canonical(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(element -> array.add(canonical(element)));
            return array;
        }
        return node;
    }
}
