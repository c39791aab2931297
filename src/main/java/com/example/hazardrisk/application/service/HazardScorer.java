package com.example.hazardrisk.application.service;

import static com.example.hazardrisk.domain.model.HazardScoreBreakdown.FATALITY_CAP;
import static com.example.hazardrisk.domain.model.HazardScoreBreakdown.FREQUENCY_CAP;
import static com.example.hazardrisk.domain.model.HazardScoreBreakdown.SERIOUS_CASE_CAP;
import static com.example.hazardrisk.domain.model.HazardScoreBreakdown.SEVERITY_CAP;

import com.example.hazardrisk.domain.model.HazardScoreBreakdown;
import org.springframework.stereotype.Component;

/**
 * Turns the four incident aggregates of a hazard category into a 0-100 score.
 * <ul>
 *     <li>frequency: incident count, saturating at {@value #FREQUENCY_SATURATION} (max 25)</li>
 *     <li>fatality: share of incidents that were fatal (max 35)</li>
 *     <li>severity: mean days away, saturating at {@value #SEVERITY_SATURATION_DAYS} days (max 25)</li>
 *     <li>serious cases: share of incidents with 30+ days away (max 15)</li>
 * </ul>
 * Components and the total are rounded to one decimal. No corpus access.
 */
@Component
public class HazardScorer {

    static final double FREQUENCY_SATURATION = 500.0;
    static final double SEVERITY_SATURATION_DAYS = 90.0;

    public HazardScoreBreakdown score(long frequency, long fatalCount, double avgDaysAway, long severeCount) {
        if (frequency <= 0) {
            return HazardScoreBreakdown.zero();
        }

        double frequencyScore = Scores.ratio(frequency, FREQUENCY_SATURATION) * FREQUENCY_CAP;
        double fatalityScore = Scores.ratio(Math.max(0, fatalCount), frequency) * FATALITY_CAP;
        double severityScore = Scores.ratio(Math.max(0.0, avgDaysAway), SEVERITY_SATURATION_DAYS) * SEVERITY_CAP;
        double seriousCaseScore = Scores.ratio(Math.max(0, severeCount), frequency) * SERIOUS_CASE_CAP;

        double raw = frequencyScore + fatalityScore + severityScore + seriousCaseScore;

        return new HazardScoreBreakdown(
                Scores.round1(Scores.clamp(raw, 0.0, 100.0)),
                Scores.round1(frequencyScore),
                Scores.round1(fatalityScore),
                Scores.round1(severityScore),
                Scores.round1(seriousCaseScore)
        );
    }
}
