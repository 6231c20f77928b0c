package com.scaniq.collector.service;

import com.scaniq.collector.dto.EvidenceItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evidence accumulated by one collection run, keyed by the URL (or search query) it came from.
 * Append-only; concurrent writers never lose items.
 */
public class EvidenceStore {

    private final Map<String, Queue<EvidenceItem>> bySource = new ConcurrentHashMap<>();
    private final Queue<EvidenceItem> all = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();

    public void add(String source, List<EvidenceItem> items) {
        if (items == null || items.isEmpty()) return;
        Queue<EvidenceItem> bucket = bySource.computeIfAbsent(source, k -> new ConcurrentLinkedQueue<>());
        for (EvidenceItem item : items) {
            bucket.add(item);
            all.add(item);
            size.incrementAndGet();
        }
    }

    public List<EvidenceItem> forSource(String source) {
        Queue<EvidenceItem> bucket = bySource.get(source);
        return bucket == null ? List.of() : List.copyOf(bucket);
    }

    public List<EvidenceItem> all() {
        return new ArrayList<>(all);
    }

    public int size() {
        return size.get();
    }

    public int sourceCount() {
        return bySource.size();
    }

    /**
     * Item counts per category tag.
     */
    public Map<String, Integer> countByCategory() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (EvidenceItem item : all) {
            counts.merge(item.category(), 1, Integer::sum);
        }
        return counts;
    }
}
