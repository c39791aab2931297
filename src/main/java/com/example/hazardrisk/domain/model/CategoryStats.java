package com.example.hazardrisk.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Headline aggregates for one hazard category.
 */
public record CategoryStats(
        long totalCount,
        long fatalCount,
        long dafwCount,
        double avgDafw,
        int maxDafw,
        double pctFatal,
        List<ValueCount> topSources,
        List<ValueCount> topBodyParts,
        Map<String, Long> yearBreakdown
) {

    public static CategoryStats empty() {
        return new CategoryStats(0, 0, 0, 0.0, 0, 0.0, List.of(), List.of(), Map.of());
    }
}
