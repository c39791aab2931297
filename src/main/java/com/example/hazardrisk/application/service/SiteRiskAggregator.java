package com.example.hazardrisk.application.service;

import com.example.hazardrisk.domain.model.HazardAssessment;
import com.example.hazardrisk.domain.model.HazardDescriptor;
import com.example.hazardrisk.domain.model.HazardScoreBreakdown;
import com.example.hazardrisk.domain.model.RiskGrade;
import com.example.hazardrisk.domain.model.SiteRiskResult;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import com.example.hazardrisk.domain.query.QueryExpander;
import com.example.hazardrisk.infrastructure.corpus.CorpusAggregates;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores every hazard of a site against the incident corpus and combines them into
 * one graded site score in which the worst hazard dominates.
 */
@Service
public class SiteRiskAggregator {

    private static final Logger log = LoggerFactory.getLogger(SiteRiskAggregator.class);

    static final int TOP_HAZARDS = 5;
    static final double WORST_WEIGHT = 0.6;
    static final double REST_WEIGHT = 0.4;

    private final CorpusAggregates aggregates;
    private final QueryExpander queryExpander;
    private final HazardScorer scorer;

    public SiteRiskAggregator(CorpusAggregates aggregates, QueryExpander queryExpander, HazardScorer scorer) {
        this.aggregates = aggregates;
        this.queryExpander = queryExpander;
        this.scorer = scorer;
    }

    public SiteRiskResult assess(Map<String, HazardDescriptor> registry) {
        long t0 = System.nanoTime();
        List<HazardAssessment> rows = new ArrayList<>();
        if (registry != null) {
            for (Map.Entry<String, HazardDescriptor> e : registry.entrySet()) {
                rows.add(assessHazard(e.getKey(), e.getValue()));
            }
        }
        rows.sort(Comparator.comparingDouble(HazardAssessment::finalScore).reversed());

        List<Double> scores = rows.stream().map(HazardAssessment::finalScore).collect(Collectors.toList());
        double siteScore = Scores.round1(compositeScore(scores));
        RiskGrade grade = RiskGrade.forScore(siteScore);

        HazardAssessment top = rows.isEmpty() ? null : rows.get(0);
        String topConcern = top == null ? "None" : top.label();
        String topConcernStats = top == null ? "" : citation(top);

        long t1 = System.nanoTime();
        log.info("event=site_risk_assessed hazards={} score={} grade={} topConcern={} ms={}",
                rows.size(), siteScore, grade, topConcern, (t1 - t0) / 1_000_000);

        return new SiteRiskResult(
                siteScore,
                grade,
                grade.explanation(),
                List.copyOf(rows),
                List.copyOf(rows.subList(0, Math.min(TOP_HAZARDS, rows.size()))),
                topConcern,
                topConcernStats,
                grade.recommendation()
        );
    }

    HazardAssessment assessHazard(String hazardId, HazardDescriptor hazard) {
        String label = hazard == null || hazard.label() == null ? "" : hazard.label();
        String category = hazard == null || hazard.category() == null ? "" : hazard.category();

        CategoryPredicateSet predicates = queryExpander.scoringPredicates(category);
        long frequency = aggregates.count(predicates);
        long fatal = aggregates.countFatal(predicates);
        double avgDaysAway = aggregates.averageDaysAway(predicates);
        long severe = aggregates.countSevere(predicates);

        HazardScoreBreakdown breakdown = scorer.score(frequency, fatal, avgDaysAway, severe);

        log.debug("event=hazard_scored hazardId={} category={} frequency={} fatal={} avgDaysAway={} severe={} score={}",
                hazardId, category, frequency, fatal, avgDaysAway, severe, breakdown.finalScore());

        return new HazardAssessment(
                hazardId,
                label,
                category,
                frequency,
                fatal,
                Scores.round3(Scores.ratio(fatal, frequency)),
                Scores.round1(avgDaysAway),
                Scores.round3(Scores.ratio(severe, frequency)),
                breakdown.finalScore(),
                breakdown
        );
    }

    /**
     * {@code scores} must be sorted highest first. None gives 0, one gives itself,
     * otherwise {@code highest * 0.6 + mean(rest) * 0.4}.
     */
    static double compositeScore(List<Double> scores) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        if (scores.size() == 1) {
            return scores.get(0);
        }
        double highest = scores.get(0);
        double restMean = scores.subList(1, scores.size()).stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        return highest * WORST_WEIGHT + restMean * REST_WEIGHT;
    }

    static String citation(HazardAssessment row) {
        return String.format(Locale.US,
                "%,d similar incidents in OSHA data. %d fatalities. Avg %s days away from work.",
                row.frequencyCount(), row.fatalCount(), Scores.fixed(row.avgDaysAway(), 1));
    }
}
