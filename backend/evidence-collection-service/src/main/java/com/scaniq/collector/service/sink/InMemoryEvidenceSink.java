package com.scaniq.collector.service.sink;

import com.scaniq.collector.dto.CollectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the most recent collections in memory; the oldest is evicted first.
 */
@Component
@Slf4j
public class InMemoryEvidenceSink implements EvidenceSink {

    private final Map<String, CollectionResult> results;

    public InMemoryEvidenceSink(@Value("${collector.sink.max-collections:50}") int maxCollections) {
        this.results = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CollectionResult> eldest) {
                boolean evict = size() > maxCollections;
                if (evict) {
                    log.debug("Evicting collection {} from sink", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized void store(CollectionResult result) {
        results.put(result.collectionId(), result);
    }

    @Override
    public synchronized Optional<CollectionResult> find(String collectionId) {
        return Optional.ofNullable(results.get(collectionId));
    }
}
