package com.scaniq.collector.service.tool;

import com.scaniq.collector.dto.EvidenceItem;

import java.util.List;
import java.util.Map;

public record CapabilityOutput(List<EvidenceItem> evidence, Map<String, Object> characteristics) {

    public CapabilityOutput {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        characteristics = characteristics == null ? Map.of() : characteristics;
    }

    public static CapabilityOutput of(List<EvidenceItem> evidence) {
        return new CapabilityOutput(evidence, Map.of());
    }
}
