package com.scaniq.collector.entity;

/**
 * Quality rating attached to an audit entry.
 */
public enum AuditQuality {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Rates a batch of evidence by its size: more than 10 items is high, more than 5 medium.
     */
    public static AuditQuality fromEvidenceCount(int count) {
        if (count > 10) return HIGH;
        if (count > 5) return MEDIUM;
        return LOW;
    }
}
