package com.scaniq.collector.service.tool;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.ToolResult;
import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.entity.ToolFailureReason;
import com.scaniq.collector.service.decision.PageContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs collection capabilities behind a single contract.
 *
 * The returned Mono never errors: unknown tools, thrown exceptions, error signals and
 * timeouts all become a failed {@link ToolResult} with an empty evidence list.
 */
@Service
@Slf4j
public class ToolExecutor {

    private final Map<CollectionTool, CollectionCapability> capabilities;
    private final EvidenceCollectionConfig config;
    private final MeterRegistry meterRegistry;

    public ToolExecutor(List<CollectionCapability> capabilities,
                        EvidenceCollectionConfig config,
                        MeterRegistry meterRegistry) {
        Map<CollectionTool, CollectionCapability> registry = new EnumMap<>(CollectionTool.class);
        for (CollectionCapability capability : capabilities) {
            CollectionCapability previous = registry.put(capability.tool(), capability);
            if (previous != null) {
                log.warn("Capability {} replaces {} for tool {}",
                        capability.getClass().getSimpleName(), previous.getClass().getSimpleName(), capability.tool());
            }
        }
        this.capabilities = Collections.unmodifiableMap(registry);
        this.config = config;
        this.meterRegistry = meterRegistry;
        log.info("Registered collection tools: {}", registry.keySet());
    }

    public Mono<ToolResult> execute(String toolCode, String url, PageContext context) {
        return CollectionTool.fromCode(toolCode)
                .map(tool -> execute(tool, url, context))
                .orElseGet(() -> {
                    log.warn("Unknown tool requested: {}", toolCode);
                    return Mono.just(ToolResult.failure(null, "Unknown tool: " + toolCode, ToolFailureReason.UNKNOWN_TOOL, 0));
                });
    }

    public Mono<ToolResult> execute(CollectionTool tool, String url, PageContext context) {
        CollectionCapability capability = capabilities.get(tool);
        if (capability == null) {
            log.warn("No capability registered for tool {}", tool);
            return Mono.just(ToolResult.failure(tool, "No capability registered for " + tool, ToolFailureReason.UNKNOWN_TOOL, 0));
        }

        return Mono.defer(() -> {
            long start = System.nanoTime();
            return Mono.defer(() -> capability.execute(url, context))
                    .timeout(config.getTools().getTimeout())
                    .map(output -> ToolResult.success(tool, output.evidence(), output.characteristics(), elapsedMs(start)))
                    .switchIfEmpty(Mono.fromSupplier(() -> ToolResult.success(tool, List.of(), Map.of(), elapsedMs(start))))
                    .onErrorResume(e -> {
                        ToolFailureReason reason = ToolFailureReason.fromException(e);
                        log.warn("Tool {} failed for {} ({}): {}", tool, url, reason, e.getMessage());
                        return Mono.just(ToolResult.failure(tool, errorMessage(e), reason, elapsedMs(start)));
                    })
                    .doOnNext(this::recordMetrics);
        });
    }

    public Optional<CollectionCapability> capability(CollectionTool tool) {
        return Optional.ofNullable(capabilities.get(tool));
    }

    public Map<CollectionTool, CollectionCapability> getCapabilities() {
        return capabilities;
    }

    private void recordMetrics(ToolResult result) {
        String outcome = result.success() ? "success" : "failure";
        Timer.builder("collector.tool.duration")
                .description("Collection tool execution time")
                .tag("tool", String.valueOf(result.tool()))
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(result.durationMs(), TimeUnit.MILLISECONDS);
        if (!result.success()) {
            meterRegistry.counter("collector.tool.failures",
                    "tool", String.valueOf(result.tool()),
                    "reason", result.failureReason().getCode()).increment();
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
