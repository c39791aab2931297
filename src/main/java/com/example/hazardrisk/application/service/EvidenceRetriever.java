package com.example.hazardrisk.application.service;

import com.example.hazardrisk.domain.model.EvidenceResult;
import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import com.example.hazardrisk.domain.query.QueryExpander;
import com.example.hazardrisk.infrastructure.corpus.IncidentCorpus;
import com.example.hazardrisk.infrastructure.search.LexicalIndexMissingException;
import com.example.hazardrisk.infrastructure.search.LexicalSearch;
import com.example.hazardrisk.infrastructure.search.MalformedQueryException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Finds real incidents that illustrate a hazard.
 * <p>
 * Candidates come from three independent passes, each capped at {@code 3 * k} ids:
 * lexical prefix search over the narratives, a substring match of the label
 * against the event-type and source classifications, and (when a category is
 * given) the category's evidence predicates. The union is fetched once and ordered
 * by severity: fatal incidents first, then by days away from work. The confidence
 * score is reported alongside each result and does not influence that order.
 */
@Service
public class EvidenceRetriever {

    private static final Logger log = LoggerFactory.getLogger(EvidenceRetriever.class);

    static final int CANDIDATE_MULTIPLIER = 3;
    static final int SNIPPET_MAX_CHARS = 150;

    static final Comparator<IncidentRecord> SEVERITY_ORDER = Comparator
            .comparing(IncidentRecord::fatal).reversed()
            .thenComparing(Comparator.comparingInt(IncidentRecord::daysAway).reversed())
            .thenComparingLong(IncidentRecord::id);

    private final IncidentCorpus corpus;
    private final LexicalSearch lexicalSearch;
    private final QueryExpander queryExpander;
    private final Executor executor;

    public EvidenceRetriever(
            IncidentCorpus corpus,
            LexicalSearch lexicalSearch,
            QueryExpander queryExpander,
            @Qualifier("retrievalExecutor") Executor executor
    ) {
        this.corpus = corpus;
        this.lexicalSearch = lexicalSearch;
        this.queryExpander = queryExpander;
        this.executor = executor;
    }

    public List<EvidenceResult> retrieve(String label, String category, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        long t0 = System.nanoTime();
        String text = label == null ? "" : label;
        int cap = k * CANDIDATE_MULTIPLIER;

        CompletableFuture<Set<Long>> lexicalF = async(() -> lexicalPass(text, cap));
        CompletableFuture<Set<Long>> classificationF = async(() -> classificationPass(text, cap));
        CompletableFuture<Set<Long>> categoryF = async(() -> categoryPass(category, cap));

        Set<Long> lexical = join(lexicalF);
        Set<Long> classification = join(classificationF);
        Set<Long> byCategory = join(categoryF);

        Set<Long> union = new LinkedHashSet<>(lexical);
        union.addAll(classification);
        union.addAll(byCategory);

        if (union.isEmpty()) {
            log.info("event=evidence_retrieve_empty category={} k={}", category, k);
            return List.of();
        }

        List<EvidenceResult> results = corpus.findByIds(union).stream()
                .sorted(SEVERITY_ORDER)
                .limit(k)
                .map(r -> toEvidence(r, lexical, classification))
                .collect(Collectors.toList());

        long t1 = System.nanoTime();
        log.info("event=evidence_retrieve_done category={} k={} lexicalN={} classificationN={} categoryN={} unionN={} outN={} ms={}",
                category, k, lexical.size(), classification.size(), byCategory.size(), union.size(), results.size(),
                (t1 - t0) / 1_000_000);
        return results;
    }

    Set<Long> lexicalPass(String label, int cap) {
        List<String> terms = tokenize(label);
        if (terms.isEmpty()) {
            return Set.of();
        }
        try {
            return new LinkedHashSet<>(lexicalSearch.search(terms, cap));
        } catch (MalformedQueryException e) {
            log.warn("event=lexical_query_rejected fallback=substring msg={}", e.getMessage());
        } catch (LexicalIndexMissingException e) {
            log.warn("event=lexical_index_missing fallback=substring msg={}", e.getMessage());
        }
        return new LinkedHashSet<>(corpus.findIdsContaining(label, IncidentField.NARRATIVE_FIELDS, cap));
    }

    Set<Long> classificationPass(String label, int cap) {
        return new LinkedHashSet<>(corpus.findIdsContaining(label, IncidentField.CLASSIFICATION_FIELDS, cap));
    }

    Set<Long> categoryPass(String category, int cap) {
        if (category == null || category.isBlank()) {
            return Set.of();
        }
        CategoryPredicateSet predicates = queryExpander.evidencePredicates(category);
        if (predicates.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(corpus.findIdsMatching(predicates, cap));
    }

    static List<String> tokenize(String label) {
        if (label == null || label.isBlank()) {
            return List.of();
        }
        return Arrays.stream(label.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toList());
    }

    static double confidence(IncidentRecord r, boolean lexicalHit, boolean classificationHit) {
        double score = 0.5;
        if (r.fatal()) {
            score += 0.3;
        }
        if (r.daysAway() > 30) {
            score += 0.1;
        } else if (r.daysAway() > 0) {
            score += 0.05;
        }
        if (lexicalHit) {
            score += 0.1;
        }
        if (classificationHit) {
            score += 0.05;
        }
        return Math.min(1.0, score);
    }

    static String snippet(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() > SNIPPET_MAX_CHARS) {
            return text.substring(0, SNIPPET_MAX_CHARS - 3) + "...";
        }
        return text;
    }

    private static EvidenceResult toEvidence(IncidentRecord r, Set<Long> lexical, Set<Long> classification) {
        String whatHappened = nz(r.whatHappened());
        return new EvidenceResult(
                r.id(),
                whatHappened,
                snippet(whatHappened),
                nz(r.injuryIllness()),
                nz(r.objectSubstance()),
                nz(r.location()),
                r.outcomeLabel(),
                r.daysAway(),
                nz(r.eventType()),
                nz(r.source()),
                nz(r.natureOfInjury()),
                nz(r.bodyPart()),
                r.year(),
                r.fatal(),
                confidence(r, lexical.contains(r.id()), classification.contains(r.id()))
        );
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    private CompletableFuture<Set<Long>> async(Supplier<Set<Long>> pass) {
        return CompletableFuture.supplyAsync(pass, executor);
    }

    private static Set<Long> join(CompletableFuture<Set<Long>> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
