package com.example.hazardrisk.infrastructure.cache;

import com.example.hazardrisk.domain.model.CategoryStats;
import java.time.Instant;
import java.util.Map;

/**
 * Persisted category statistics. {@code schemaVersion} must equal
 * {@link #CURRENT_SCHEMA_VERSION} for the document to be trusted.
 */
public record AggregateSnapshot(int schemaVersion, Instant generatedAt, Map<String, CategoryStats> categories) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static AggregateSnapshot of(Map<String, CategoryStats> categories) {
        return new AggregateSnapshot(CURRENT_SCHEMA_VERSION, Instant.now(), categories);
    }
}
