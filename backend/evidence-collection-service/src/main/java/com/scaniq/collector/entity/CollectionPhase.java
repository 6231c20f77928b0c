package com.scaniq.collector.entity;

/**
 * Phases of a collection run, as recorded in the audit trail.
 */
public enum CollectionPhase {
    DISCOVERY("discovery"),
    CRAWL("intelligent-crawl"),
    SEARCH("agentic-search"),
    THESIS_SEARCH("thesis-search"),
    GAP_ANALYSIS("gap-analysis"),
    TARGETED("targeted-collection"),
    PROCESSING("processing");

    private final String code;

    CollectionPhase(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
