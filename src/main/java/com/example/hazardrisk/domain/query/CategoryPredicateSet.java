package com.example.hazardrisk.domain.query;

import com.example.hazardrisk.domain.model.IncidentRecord;
import java.util.List;

/**
 * Ordered field-match clauses derived from a hazard category.
 * <p>
 * A record matches when every {@code allOf} clause matches and, if {@code anyOf}
 * is non-empty, at least one {@code anyOf} clause matches. A set with no clauses
 * matches nothing.
 */
public record CategoryPredicateSet(List<FieldMatch> anyOf, List<FieldMatch> allOf) {

    private static final CategoryPredicateSet EMPTY = new CategoryPredicateSet(List.of(), List.of());

    public CategoryPredicateSet {
        anyOf = anyOf == null ? List.of() : List.copyOf(anyOf);
        allOf = allOf == null ? List.of() : List.copyOf(allOf);
    }

    public static CategoryPredicateSet empty() {
        return EMPTY;
    }

    public static CategoryPredicateSet anyOf(FieldMatch... clauses) {
        return new CategoryPredicateSet(List.of(clauses), List.of());
    }

    public CategoryPredicateSet requiring(FieldMatch... clauses) {
        return new CategoryPredicateSet(anyOf, List.of(clauses));
    }

    public boolean isEmpty() {
        return anyOf.isEmpty() && allOf.isEmpty();
    }

    public boolean matches(IncidentRecord record) {
        if (isEmpty()) {
            return false;
        }
        for (FieldMatch m : allOf) {
            if (!m.matches(record)) {
                return false;
            }
        }
        if (anyOf.isEmpty()) {
            return true;
        }
        for (FieldMatch m : anyOf) {
            if (m.matches(record)) {
                return true;
            }
        }
        return false;
    }
}
