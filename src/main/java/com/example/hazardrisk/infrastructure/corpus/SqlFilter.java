package com.example.hazardrisk.infrastructure.corpus;

import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import com.example.hazardrisk.domain.query.FieldMatch;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Parameterized WHERE fragment. Field-match fragments are bound as LIKE patterns,
 * never concatenated into the SQL text.
 */
record SqlFilter(String clause, List<Object> params) {

    static final String NONE = "1 = 0";

    static SqlFilter of(CategoryPredicateSet predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return new SqlFilter(NONE, List.of());
        }
        List<Object> params = new ArrayList<>();
        StringJoiner and = new StringJoiner(" AND ", "(", ")");
        for (FieldMatch m : predicates.allOf()) {
            and.add(like(m.field()));
            params.add(containsPattern(m.fragment()));
        }
        if (!predicates.anyOf().isEmpty()) {
            StringJoiner or = new StringJoiner(" OR ", "(", ")");
            for (FieldMatch m : predicates.anyOf()) {
                or.add(like(m.field()));
                params.add(containsPattern(m.fragment()));
            }
            and.add(or.toString());
        }
        return new SqlFilter(and.toString(), List.copyOf(params));
    }

    static SqlFilter containsAny(String text, Collection<IncidentField> fields) {
        if (fields == null || fields.isEmpty()) {
            return new SqlFilter(NONE, List.of());
        }
        String pattern = containsPattern(text);
        List<Object> params = new ArrayList<>(fields.size());
        StringJoiner or = new StringJoiner(" OR ", "(", ")");
        for (IncidentField f : fields) {
            or.add(like(f));
            params.add(pattern);
        }
        return new SqlFilter(or.toString(), List.copyOf(params));
    }

    SqlFilter and(String extraClause, Object... extraParams) {
        List<Object> merged = new ArrayList<>(params);
        merged.addAll(List.of(extraParams));
        return new SqlFilter(clause + " AND " + extraClause, List.copyOf(merged));
    }

    Object[] paramsWith(Object... trailing) {
        List<Object> all = new ArrayList<>(params);
        all.addAll(List.of(trailing));
        return all.toArray();
    }

    private static String like(IncidentField field) {
        return "LOWER(" + field.column() + ") LIKE ? ESCAPE '\\'";
    }

    static String containsPattern(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        String escaped = lower
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
