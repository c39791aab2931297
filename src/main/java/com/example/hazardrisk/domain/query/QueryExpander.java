package com.example.hazardrisk.domain.query;

import static com.example.hazardrisk.domain.model.IncidentField.EVENT_TYPE;
import static com.example.hazardrisk.domain.model.IncidentField.SOURCE;
import static com.example.hazardrisk.domain.model.IncidentField.WHAT_HAPPENED;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps a hazard category to the field predicates used to find its incidents.
 * <p>
 * Categories are matched case-insensitively against ordered keyword tables; the
 * first row with a keyword contained in the category wins. There is one table per
 * consumer, because the three consumers have always matched categories
 * differently:
 * <ul>
 *     <li>evidence: broad, recall-oriented clauses for the retriever's category pass</li>
 *     <li>scoring: the clauses hazard scores are aggregated over</li>
 *     <li>statistics: the clauses the per-category statistics are computed over</li>
 * </ul>
 * Categories matching no row fall back to a substring match of the category itself
 * against the event type. A blank category yields no evidence predicates; for
 * scoring and statistics it passes through as an empty fragment, which matches
 * every incident that has an event type.
 */
@Component
public class QueryExpander {

    record CategoryRule(List<String> keywords, CategoryPredicateSet predicates) {

        static CategoryRule of(List<String> keywords, CategoryPredicateSet predicates) {
            return new CategoryRule(keywords, predicates);
        }

        boolean appliesTo(String lowerCategory) {
            for (String k : keywords) {
                if (lowerCategory.contains(k)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final CategoryPredicateSet FALL = CategoryPredicateSet.anyOf(FieldMatch.of(EVENT_TYPE, "fall"));

    private static final CategoryPredicateSet ELECTRICAL = CategoryPredicateSet.anyOf(
            FieldMatch.of(EVENT_TYPE, "contact with electric"),
            FieldMatch.of(EVENT_TYPE, "contact with wiring"),
            FieldMatch.of(SOURCE, "electric"),
            FieldMatch.of(SOURCE, "wiring"),
            FieldMatch.of(SOURCE, "power line"),
            FieldMatch.of(WHAT_HAPPENED, "electrocuted"),
            FieldMatch.of(WHAT_HAPPENED, "electric shock")
    );

    private static final CategoryPredicateSet STRUCK = CategoryPredicateSet.anyOf(FieldMatch.of(EVENT_TYPE, "struck"));

    private static final CategoryPredicateSet CAUGHT_IN = CategoryPredicateSet.anyOf(
            FieldMatch.of(EVENT_TYPE, "caught"),
            FieldMatch.of(EVENT_TYPE, "compress")
    );

    private static final CategoryPredicateSet FIRE_AND_BURNS = CategoryPredicateSet.anyOf(
            FieldMatch.of(EVENT_TYPE, "fire"),
            FieldMatch.of(EVENT_TYPE, "explosion"),
            FieldMatch.of(EVENT_TYPE, "burn")
    );

    static final List<CategoryRule> EVIDENCE_RULES = List.of(
            CategoryRule.of(List.of("fall"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "fall"),
                    FieldMatch.of(SOURCE, "ladder"),
                    FieldMatch.of(SOURCE, "scaffold"),
                    FieldMatch.of(SOURCE, "roof"))),
            CategoryRule.of(List.of("electric"), ELECTRICAL),
            CategoryRule.of(List.of("struck", "hit"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "struck"),
                    FieldMatch.of(EVENT_TYPE, "hit"))),
            CategoryRule.of(List.of("caught", "compress"), CAUGHT_IN),
            CategoryRule.of(List.of("chemical"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "expos"),
                    FieldMatch.of(SOURCE, "chemical"))),
            CategoryRule.of(List.of("slip", "trip"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "slip"),
                    FieldMatch.of(EVENT_TYPE, "trip"),
                    FieldMatch.of(EVENT_TYPE, "same level"))),
            CategoryRule.of(List.of("fire", "explosion"), FIRE_AND_BURNS)
    );

    static final List<CategoryRule> SCORING_RULES = List.of(
            CategoryRule.of(List.of("fall"), FALL),
            CategoryRule.of(List.of("electric"), ELECTRICAL),
            CategoryRule.of(List.of("struck"), STRUCK),
            CategoryRule.of(List.of("caught", "compress"), CAUGHT_IN),
            CategoryRule.of(List.of("chemical"), CategoryPredicateSet.anyOf(
                            FieldMatch.of(SOURCE, "chemical"),
                            FieldMatch.of(SOURCE, "toxic"))
                    .requiring(FieldMatch.of(EVENT_TYPE, "expos"))),
            CategoryRule.of(List.of("slip", "trip"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "fall on same level"),
                    FieldMatch.of(EVENT_TYPE, "slip"),
                    FieldMatch.of(EVENT_TYPE, "trip"))),
            CategoryRule.of(List.of("fire"), FIRE_AND_BURNS)
    );

    static final List<CategoryRule> STATS_RULES = List.of(
            CategoryRule.of(List.of("fall"), FALL),
            CategoryRule.of(List.of("electric"), ELECTRICAL),
            CategoryRule.of(List.of("struck"), STRUCK),
            CategoryRule.of(List.of("caught", "between"), CAUGHT_IN),
            CategoryRule.of(List.of("slip", "trip"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "fall on same level"),
                    FieldMatch.of(EVENT_TYPE, "slip"))),
            CategoryRule.of(List.of("fire", "explosion"), CategoryPredicateSet.anyOf(
                    FieldMatch.of(EVENT_TYPE, "fire"),
                    FieldMatch.of(EVENT_TYPE, "explosion")))
    );

    /**
     * Predicates for the evidence retriever's category pass. Empty for a blank category.
     */
    public CategoryPredicateSet evidencePredicates(String category) {
        if (category == null || category.isBlank()) {
            return CategoryPredicateSet.empty();
        }
        return expand(EVIDENCE_RULES, category);
    }

    /**
     * Predicates hazard scores are aggregated over.
     */
    public CategoryPredicateSet scoringPredicates(String category) {
        return expand(SCORING_RULES, category == null ? "" : category);
    }

    /**
     * Predicates the per-category statistics are computed over.
     */
    public CategoryPredicateSet statsPredicates(String category) {
        return expand(STATS_RULES, category == null ? "" : category);
    }

    private static CategoryPredicateSet expand(List<CategoryRule> rules, String category) {
        String lower = category.toLowerCase(Locale.ROOT);
        for (CategoryRule rule : rules) {
            if (rule.appliesTo(lower)) {
                return rule.predicates();
            }
        }
        return CategoryPredicateSet.anyOf(FieldMatch.of(EVENT_TYPE, category));
    }
}
