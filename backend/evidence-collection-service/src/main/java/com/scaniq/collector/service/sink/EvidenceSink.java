package com.scaniq.collector.service.sink;

import com.scaniq.collector.dto.CollectionResult;

import java.util.Optional;

/**
 * Receives finished collections for downstream report generation.
 */
public interface EvidenceSink {

    void store(CollectionResult result);

    Optional<CollectionResult> find(String collectionId);
}
