package com.scaniq.collector.dto;

import java.util.List;

/**
 * Share of the coverage categories holding at least one evidence item.
 */
public record CoverageReport(
        int percentage,
        List<String> foundCategories,
        List<String> missingCategories
) {
}
