package com.scaniq.collector.client;

import com.scaniq.collector.dto.SearchHit;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Web search backend.
 */
public interface SearchProvider {

    /**
     * Runs one query. An unconfigured provider completes with an empty list.
     */
    Mono<List<SearchHit>> search(String query, int limit);

    boolean isAvailable();

    String getName();
}
