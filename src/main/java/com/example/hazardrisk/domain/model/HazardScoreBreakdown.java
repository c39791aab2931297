package com.example.hazardrisk.domain.model;

public record HazardScoreBreakdown(
        double finalScore,
        double frequencyScore,
        double fatalityScore,
        double severityScore,
        double seriousCaseScore
) {

    public static final double FREQUENCY_CAP = 25.0;
    public static final double FATALITY_CAP = 35.0;
    public static final double SEVERITY_CAP = 25.0;
    public static final double SERIOUS_CASE_CAP = 15.0;

    public static HazardScoreBreakdown zero() {
        return new HazardScoreBreakdown(0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
