package com.example.hazardrisk.domain.query;

import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.IncidentRecord;
import java.util.Locale;
import java.util.Objects;

/**
 * Case-insensitive substring clause over one incident field.
 */
public record FieldMatch(IncidentField field, String fragment) {

    public FieldMatch {
        Objects.requireNonNull(field, "field");
        fragment = fragment == null ? "" : fragment.toLowerCase(Locale.ROOT);
    }

    public static FieldMatch of(IncidentField field, String fragment) {
        return new FieldMatch(field, fragment);
    }

    public boolean matches(IncidentRecord record) {
        String value = record.valueOf(field);
        return value != null && value.toLowerCase(Locale.ROOT).contains(fragment);
    }
}
