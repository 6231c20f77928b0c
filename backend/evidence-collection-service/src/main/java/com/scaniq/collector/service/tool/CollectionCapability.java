package com.scaniq.collector.service.tool;

import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.service.decision.PageContext;
import reactor.core.publisher.Mono;

/**
 * A collection tool the executor can run against a URL.
 * Implementations may fail freely; {@link ToolExecutor} turns every failure into a failed result.
 */
public interface CollectionCapability {

    CollectionTool tool();

    Mono<CapabilityOutput> execute(String url, PageContext context);

    default boolean isAvailable() {
        return true;
    }
}
