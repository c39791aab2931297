package com.example.hazardrisk.support;

import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.domain.model.OutcomeCode;
import com.example.hazardrisk.domain.model.ValueCount;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import com.example.hazardrisk.infrastructure.corpus.CorpusAggregates;
import com.example.hazardrisk.infrastructure.corpus.IncidentCorpus;
import com.example.hazardrisk.infrastructure.search.LexicalSearch;
import com.example.hazardrisk.infrastructure.search.MalformedQueryException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Fixture corpus evaluating predicates in memory. The lexical side ranks records by
 * the number of query terms that prefix-match a word in the narrative fields and
 * rejects terms containing query syntax characters, like the real engine would.
 */
public class InMemoryIncidentCorpus implements IncidentCorpus, CorpusAggregates, LexicalSearch {

    private final List<IncidentRecord> records;
    public final AtomicInteger findByIdsCalls = new AtomicInteger();
    public final AtomicInteger lexicalCalls = new AtomicInteger();
    /** Limits requested by the candidate lookups, in call order. */
    public final List<Integer> limits = Collections.synchronizedList(new ArrayList<>());

    public InMemoryIncidentCorpus(IncidentRecord... records) {
        this(Arrays.asList(records));
    }

    public InMemoryIncidentCorpus(List<IncidentRecord> records) {
        this.records = records.stream()
                .sorted(Comparator.comparingLong(IncidentRecord::id))
                .collect(Collectors.toList());
    }

    @Override
    public List<Long> findIdsMatching(CategoryPredicateSet predicates, int limit) {
        limits.add(limit);
        return ids(matching(predicates), limit);
    }

    @Override
    public List<Long> findIdsContaining(String text, Set<IncidentField> fields, int limit) {
        limits.add(limit);
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String needle = text.toLowerCase(Locale.ROOT);
        Predicate<IncidentRecord> p = r -> fields.stream()
                .map(r::valueOf)
                .anyMatch(v -> v != null && v.toLowerCase(Locale.ROOT).contains(needle));
        return ids(records.stream().filter(p), limit);
    }

    @Override
    public List<IncidentRecord> findByIds(Collection<Long> ids) {
        findByIdsCalls.incrementAndGet();
        Set<Long> wanted = new HashSet<>(ids);
        return records.stream().filter(r -> wanted.contains(r.id())).collect(Collectors.toList());
    }

    @Override
    public List<IncidentRecord> findPage(long afterId, int limit) {
        return records.stream().filter(r -> r.id() > afterId).limit(limit).collect(Collectors.toList());
    }

    @Override
    public List<Long> search(List<String> terms, int limit) {
        lexicalCalls.incrementAndGet();
        limits.add(limit);
        for (String t : terms) {
            if (t.matches(".*[()\"\\[\\]{}:^~].*")) {
                throw new MalformedQueryException("cannot parse '" + String.join(" ", terms) + "'", null);
            }
        }
        return records.stream()
                .map(r -> Map.entry(r, lexicalHits(r, terms)))
                .filter(e -> e.getValue() > 0)
                .sorted(Map.Entry.<IncidentRecord, Integer>comparingByValue().reversed()
                        .thenComparing(e -> e.getKey().id()))
                .limit(limit)
                .map(e -> e.getKey().id())
                .collect(Collectors.toList());
    }

    private static int lexicalHits(IncidentRecord r, List<String> terms) {
        List<String> words = IncidentField.NARRATIVE_FIELDS.stream()
                .map(r::valueOf)
                .filter(v -> v != null)
                .flatMap(v -> Arrays.stream(v.toLowerCase(Locale.ROOT).split("\\W+")))
                .collect(Collectors.toList());
        int hits = 0;
        for (String t : terms) {
            if (words.stream().anyMatch(w -> w.startsWith(t))) {
                hits++;
            }
        }
        return hits;
    }

    @Override
    public long count(CategoryPredicateSet predicates) {
        return matching(predicates).count();
    }

    @Override
    public long countFatal(CategoryPredicateSet predicates) {
        return matching(predicates).filter(IncidentRecord::fatal).count();
    }

    @Override
    public double averageDaysAway(CategoryPredicateSet predicates) {
        return matching(predicates).filter(r -> r.daysAway() > 0)
                .mapToInt(IncidentRecord::daysAway).average().orElse(0.0);
    }

    @Override
    public long countSevere(CategoryPredicateSet predicates) {
        return matching(predicates).filter(r -> r.daysAway() >= SEVERE_DAYS_THRESHOLD).count();
    }

    @Override
    public long countDaysAwayCases(CategoryPredicateSet predicates) {
        return matching(predicates).filter(r -> r.outcome() == OutcomeCode.DAYS_AWAY).count();
    }

    @Override
    public int maxDaysAway(CategoryPredicateSet predicates) {
        return matching(predicates).mapToInt(IncidentRecord::daysAway).max().orElse(0);
    }

    @Override
    public List<ValueCount> topValues(IncidentField field, CategoryPredicateSet predicates, int limit) {
        Map<String, Long> counts = matching(predicates)
                .map(r -> r.valueOf(field))
                .filter(v -> v != null && !v.isEmpty())
                .collect(Collectors.groupingBy(v -> v, TreeMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .map(e -> new ValueCount(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public Map<Integer, Long> yearBreakdown(CategoryPredicateSet predicates) {
        return matching(predicates)
                .filter(r -> r.year() != null)
                .collect(Collectors.groupingBy(IncidentRecord::year, TreeMap::new, Collectors.counting()))
                .entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private Stream<IncidentRecord> matching(CategoryPredicateSet predicates) {
        return records.stream().filter(predicates::matches);
    }

    private static List<Long> ids(Stream<IncidentRecord> stream, int limit) {
        return stream.limit(limit).map(IncidentRecord::id).collect(Collectors.toList());
    }
}
