package com.scaniq.collector.dto;

import com.scaniq.collector.entity.CollectionTool;

/**
 * Next step chosen for a page. A decision without a tool ends the page loop.
 */
public record Decision(
        CollectionTool tool,
        String reasoning,
        int priority,
        int expectedEvidence
) {
    public static Decision run(CollectionTool tool, String reasoning, int priority, int expectedEvidence) {
        return new Decision(tool, reasoning, priority, expectedEvidence);
    }

    public static Decision stop(String reasoning) {
        return new Decision(null, reasoning, 0, 0);
    }

    public boolean isTerminal() {
        return tool == null;
    }
}
