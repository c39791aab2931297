package com.example.hazardrisk.application.service;

import com.example.hazardrisk.domain.model.CategoryStats;
import com.example.hazardrisk.domain.model.EvidenceResult;
import com.example.hazardrisk.domain.model.HazardAssessment;
import com.example.hazardrisk.domain.model.HazardScoreBreakdown;
import com.example.hazardrisk.domain.model.SiteRiskResult;
import com.example.hazardrisk.domain.model.ValueCount;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text renderings for chat and console consumers.
 */
public final class RiskReportFormatter {

    private static final String RULE = "=".repeat(70);
    private static final String THIN_RULE = "-".repeat(70);

    private RiskReportFormatter() {
    }

    public static String formatEvidence(List<EvidenceResult> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return "No matching incidents found.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Real OSHA incidents matching this hazard:");
        int i = 1;
        for (EvidenceResult e : evidence) {
            String year = e.year() == null ? "Unknown" : String.valueOf(e.year());
            List<String> injury = new ArrayList<>();
            if (!e.natureOfInjury().isEmpty()) {
                injury.add(e.natureOfInjury());
            }
            if (!e.bodyPart().isEmpty()) {
                injury.add(e.bodyPart());
            }
            String injurySummary = injury.isEmpty() ? "Injury details not available" : String.join(", ", injury);
            lines.add(" " + i++ + ". [" + year + " | " + e.outcome() + "] " + e.snippet() + " -> " + injurySummary);
        }
        return String.join("\n", lines);
    }

    public static String formatSiteReport(SiteRiskResult result) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("SITE RISK ASSESSMENT (Based on OSHA Historical Data)");
        lines.add(RULE);
        lines.add("");
        lines.add("Overall Risk Score: " + result.score() + "/100");
        lines.add("Grade: " + result.grade());
        lines.add("");
        lines.add(result.gradeExplanation());
        lines.add("");
        lines.add("Recommendation: " + result.recommendation());
        lines.add("");
        lines.add("Top Concern: " + result.topConcern());
        lines.add("  " + result.topConcernStats());

        lines.add("");
        lines.add(THIN_RULE);
        lines.add("TOP 5 HAZARDS (Ranked by Risk Score)");
        lines.add(THIN_RULE);
        int rank = 1;
        for (HazardAssessment h : result.topHazards()) {
            HazardScoreBreakdown sc = h.components();
            lines.add("");
            lines.add(String.format(Locale.US, "#%d. %s (%s) - Score: %s/100", rank++, h.label(), h.category(), h.finalScore()));
            lines.add(String.format(Locale.US, "    Frequency:     %5s/25 pts  (%,d incidents)",
                    Scores.fixed(sc.frequencyScore(), 1), h.frequencyCount()));
            lines.add(String.format(Locale.US, "    Fatality Rate: %5s/35 pts  (%s%% fatal)",
                    Scores.fixed(sc.fatalityScore(), 1), Scores.fixed(h.fatalityRate() * 100, 1)));
            lines.add(String.format(Locale.US, "    Severity:      %5s/25 pts  (avg %s days away)",
                    Scores.fixed(sc.severityScore(), 1), Scores.fixed(h.avgDaysAway(), 1)));
            lines.add(String.format(Locale.US, "    Serious Cases: %5s/15 pts  (%s%% with 30+ days)",
                    Scores.fixed(sc.seriousCaseScore(), 1), Scores.fixed(h.severeRate() * 100, 1)));
        }

        List<HazardAssessment> remaining = result.breakdown().size() > result.topHazards().size()
                ? result.breakdown().subList(result.topHazards().size(), result.breakdown().size())
                : List.of();
        if (!remaining.isEmpty()) {
            lines.add("");
            lines.add(THIN_RULE);
            lines.add("OTHER HAZARDS");
            lines.add(THIN_RULE);
            for (HazardAssessment h : remaining) {
                lines.add("");
                lines.add(String.format(Locale.US, "%s (%s) - Score: %s/100", h.label(), h.category(), h.finalScore()));
                lines.add(String.format(Locale.US, "    %,d incidents | %s%% fatal | avg %s days away",
                        h.frequencyCount(), Scores.fixed(h.fatalityRate() * 100, 1), Scores.fixed(h.avgDaysAway(), 1)));
            }
        }

        lines.add("");
        lines.add(RULE);
        return String.join("\n", lines);
    }

    public static String formatHeadline(String category, CategoryStats stats) {
        if (stats == null) {
            return "No statistics available for " + category + ".";
        }
        if (stats.totalCount() == 0) {
            return "No " + category + " incidents found in dataset.";
        }
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.US, "%,d %s incidents recorded.", stats.totalCount(), category));
        parts.add(String.format(Locale.US, "%d fatalities (%s%%).", stats.fatalCount(), Scores.fixed(stats.pctFatal(), 1)));
        if (stats.avgDafw() > 0) {
            parts.add("Workers averaged " + Scores.fixed(stats.avgDafw(), 0) + " days away from work.");
        }
        List<ValueCount> sources = stats.topSources();
        if (sources.size() >= 2) {
            parts.add("Most common causes: " + sources.get(0).value() + ", " + sources.get(1).value() + ".");
        } else if (sources.size() == 1) {
            parts.add("Most common cause: " + sources.get(0).value() + ".");
        }
        if (!stats.topBodyParts().isEmpty()) {
            parts.add("Most affected: " + stats.topBodyParts().get(0).value() + ".");
        }
        return String.join(" ", parts);
    }

    public static String formatCategoryStats(String category, CategoryStats stats) {
        if (stats == null) {
            return "No statistics available for " + category + ".";
        }
        if (stats.totalCount() == 0) {
            return "No " + category + " incidents found in dataset.";
        }
        List<String> lines = new ArrayList<>();
        lines.add(category + " Statistics");
        lines.add("=".repeat(60));
        lines.add(String.format(Locale.US, "Total Incidents: %,d", stats.totalCount()));
        lines.add(String.format(Locale.US, "Fatalities: %d (%s%%)", stats.fatalCount(), Scores.fixed(stats.pctFatal(), 1)));
        lines.add(String.format(Locale.US, "Days Away from Work Cases: %,d", stats.dafwCount()));
        lines.add("Average Days Away: " + Scores.fixed(stats.avgDafw(), 1) + " days");
        lines.add("Maximum Days Away: " + stats.maxDafw() + " days");

        if (!stats.topSources().isEmpty()) {
            lines.add("");
            lines.add("Top 3 Causes:");
            appendRanked(lines, stats.topSources());
        }
        if (!stats.topBodyParts().isEmpty()) {
            lines.add("");
            lines.add("Top 3 Affected Body Parts:");
            appendRanked(lines, stats.topBodyParts());
        }
        if (!stats.yearBreakdown().isEmpty()) {
            lines.add("");
            lines.add("Year Breakdown:");
            stats.yearBreakdown().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> lines.add(String.format(Locale.US, "  %s: %,d incidents", e.getKey(), e.getValue())));
        }
        return String.join("\n", lines);
    }

    private static void appendRanked(List<String> lines, List<ValueCount> values) {
        int i = 1;
        for (ValueCount v : values) {
            lines.add(String.format(Locale.US, "  %d. %s: %,d incidents", i++, v.value(), v.count()));
        }
    }
}
