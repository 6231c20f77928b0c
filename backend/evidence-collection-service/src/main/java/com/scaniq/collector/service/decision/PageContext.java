package com.scaniq.collector.service.decision;

import com.scaniq.collector.dto.ToolResult;
import com.scaniq.collector.entity.CollectionTool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What is known about one URL while its collection loop runs.
 * Immutable: every iteration derives the next context through {@link #advance}.
 */
public record PageContext(
        String url,
        List<CollectionTool> toolsRun,
        Map<String, Object> characteristics,
        int loopCount,
        int evidenceCount
) {
    public PageContext {
        if (loopCount < 0 || evidenceCount < 0) {
            throw new IllegalArgumentException("counters must not be negative");
        }
        toolsRun = List.copyOf(toolsRun);
        characteristics = Map.copyOf(characteristics);
    }

    public static PageContext initial(String url) {
        return new PageContext(url, List.of(), Map.of(), 0, 0);
    }

    /**
     * Context after running {@code tool}. The tool is recorded even when it failed.
     */
    public PageContext advance(CollectionTool tool, ToolResult result) {
        List<CollectionTool> tools = new ArrayList<>(toolsRun);
        if (!tools.contains(tool)) {
            tools.add(tool);
        }
        Map<String, Object> merged = new LinkedHashMap<>(characteristics);
        result.characteristics().forEach((k, v) -> {
            if (v != null) merged.put(k, v);
        });
        return new PageContext(url, tools, merged, loopCount + 1, evidenceCount + result.evidence().size());
    }

    public boolean hasRun(CollectionTool tool) {
        return toolsRun.contains(tool);
    }

    public boolean flag(String characteristic) {
        return Boolean.TRUE.equals(characteristics.get(characteristic));
    }
}
