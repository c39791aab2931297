package com.example.hazardrisk.infrastructure.corpus;

import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.ValueCount;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import java.util.List;
import java.util.Map;

/**
 * Aggregate queries over the incidents matching a predicate set. An empty
 * predicate set matches no incidents.
 */
public interface CorpusAggregates {

    int SEVERE_DAYS_THRESHOLD = 30;

    long count(CategoryPredicateSet predicates);

    long countFatal(CategoryPredicateSet predicates);

    /**
     * Mean days away over matching incidents with at least one day away, 0.0 when there are none.
     */
    double averageDaysAway(CategoryPredicateSet predicates);

    /**
     * Matching incidents with {@value #SEVERE_DAYS_THRESHOLD} or more days away.
     */
    long countSevere(CategoryPredicateSet predicates);

    long countDaysAwayCases(CategoryPredicateSet predicates);

    int maxDaysAway(CategoryPredicateSet predicates);

    List<ValueCount> topValues(IncidentField field, CategoryPredicateSet predicates, int limit);

    Map<Integer, Long> yearBreakdown(CategoryPredicateSet predicates);
}
