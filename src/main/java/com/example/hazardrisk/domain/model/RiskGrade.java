package com.example.hazardrisk.domain.model;

/**
 * Letter bands over the composite site score. Upper bounds are inclusive.
 */
public enum RiskGrade {

    A(20.0,
            "A: 0-20 risk range. Low risk site. Standard safety protocols sufficient.",
            "Low-risk site. Standard safety protocols sufficient."),
    B(40.0,
            "B: 21-40 risk range. Moderate risk. Enhanced safety measures recommended.",
            "Moderate-risk site. Enhanced safety measures recommended."),
    C(60.0,
            "C: 41-60 risk range. Elevated risk. Regular safety audits required.",
            "Elevated-risk site. Regular safety audits and training required."),
    D(80.0,
            "D: 61-80 risk range. High-risk site. Immediate corrective action recommended.",
            "High-risk site. Daily safety briefings required. Immediate corrective action needed."),
    F(Double.POSITIVE_INFINITY,
            "F: 81-100 risk range. Critical risk. Site shutdown may be required until hazards are mitigated.",
            "Critical-risk site. Consider site shutdown until hazards are mitigated. Emergency safety protocols required.");

    private final double upperBound;
    private final String explanation;
    private final String recommendation;

    RiskGrade(double upperBound, String explanation, String recommendation) {
        this.upperBound = upperBound;
        this.explanation = explanation;
        this.recommendation = recommendation;
    }

    public static RiskGrade forScore(double score) {
        for (RiskGrade grade : values()) {
            if (score <= grade.upperBound) {
                return grade;
            }
        }
        return F;
    }

    public String explanation() {
        return explanation;
    }

    public String recommendation() {
        return recommendation;
    }
}
