package com.example.hazardrisk.application.service;

import com.example.hazardrisk.domain.model.CategoryStats;
import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.ValueCount;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import com.example.hazardrisk.domain.query.QueryExpander;
import com.example.hazardrisk.infrastructure.cache.AggregateSnapshot;
import com.example.hazardrisk.infrastructure.cache.AggregateSnapshotStore;
import com.example.hazardrisk.infrastructure.corpus.CorpusAggregates;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Citation-ready statistics per hazard category.
 * <p>
 * {@link #allStats()} is served from the on-disk snapshot when it is valid and
 * recomputed from the corpus otherwise. A recomputed map replaces the snapshot.
 */
@Service
public class CategoryStatsService {

    private static final Logger log = LoggerFactory.getLogger(CategoryStatsService.class);

    static final int TOP_N = 3;

    private final CorpusAggregates aggregates;
    private final QueryExpander queryExpander;
    private final AggregateSnapshotStore snapshotStore;
    private final List<String> categories;

    private final Object loadLock = new Object();
    private volatile Map<String, CategoryStats> current;

    public CategoryStatsService(
            CorpusAggregates aggregates,
            QueryExpander queryExpander,
            AggregateSnapshotStore snapshotStore,
            @Value("${hazardrisk.stats.categories}") List<String> categories
    ) {
        this.aggregates = aggregates;
        this.queryExpander = queryExpander;
        this.snapshotStore = snapshotStore;
        this.categories = List.copyOf(categories);
    }

    /**
     * Live statistics for any category, bypassing the snapshot.
     */
    public CategoryStats statsFor(String category) {
        CategoryPredicateSet predicates = queryExpander.statsPredicates(category);
        long total = aggregates.count(predicates);
        if (total == 0) {
            return CategoryStats.empty();
        }
        long fatal = aggregates.countFatal(predicates);
        long dafw = aggregates.countDaysAwayCases(predicates);
        double avg = Scores.round1(aggregates.averageDaysAway(predicates));
        int max = aggregates.maxDaysAway(predicates);
        double pctFatal = Scores.round1(fatal * 100.0 / total);
        List<ValueCount> topSources = aggregates.topValues(IncidentField.SOURCE, predicates, TOP_N);
        List<ValueCount> topBodyParts = aggregates.topValues(IncidentField.BODY_PART, predicates, TOP_N);

        Map<String, Long> years = new LinkedHashMap<>();
        aggregates.yearBreakdown(predicates).entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> years.put(String.valueOf(e.getKey()), e.getValue()));

        return new CategoryStats(total, fatal, dafw, avg, max, pctFatal,
                List.copyOf(topSources), List.copyOf(topBodyParts), Collections.unmodifiableMap(years));
    }

    public Map<String, CategoryStats> allStats() {
        Map<String, CategoryStats> snapshot = current;
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (loadLock) {
            if (current == null) {
                current = snapshotStore.load(categories)
                        .map(s -> Collections.unmodifiableMap(new LinkedHashMap<>(s.categories())))
                        .orElseGet(this::rebuild);
            }
            return current;
        }
    }

    /**
     * Recomputes every configured category from the corpus and rewrites the snapshot.
     */
    public Map<String, CategoryStats> refresh() {
        synchronized (loadLock) {
            current = rebuild();
            return current;
        }
    }

    public String headline(String category) {
        CategoryStats stats = allStats().get(category);
        return RiskReportFormatter.formatHeadline(category, stats);
    }

    public String detailedReport(String category) {
        CategoryStats stats = allStats().get(category);
        return RiskReportFormatter.formatCategoryStats(category, stats);
    }

    private Map<String, CategoryStats> rebuild() {
        long t0 = System.nanoTime();
        Map<String, CategoryStats> out = new LinkedHashMap<>();
        for (String category : categories) {
            CategoryStats stats = statsFor(category);
            out.put(category, stats);
            log.debug("event=category_stats_computed category={} total={}", category, stats.totalCount());
        }
        Map<String, CategoryStats> result = Collections.unmodifiableMap(out);
        snapshotStore.save(AggregateSnapshot.of(result));
        log.info("event=category_stats_rebuilt categories={} ms={}", out.size(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }
}
