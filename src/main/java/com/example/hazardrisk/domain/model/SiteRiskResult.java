package com.example.hazardrisk.domain.model;

import java.util.List;

public record SiteRiskResult(
        double score,
        RiskGrade grade,
        String gradeExplanation,
        List<HazardAssessment> breakdown,
        List<HazardAssessment> topHazards,
        String topConcern,
        String topConcernStats,
        String recommendation
) {
}
