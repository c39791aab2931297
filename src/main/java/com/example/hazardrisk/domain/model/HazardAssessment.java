package com.example.hazardrisk.domain.model;

/**
 * One breakdown row of a site assessment: the aggregates pulled for a hazard's
 * category and the score computed from them.
 */
public record HazardAssessment(
        String hazardId,
        String label,
        String category,
        long frequencyCount,
        long fatalCount,
        double fatalityRate,
        double avgDaysAway,
        double severeRate,
        double finalScore,
        HazardScoreBreakdown components
) {
}
