package com.example.hazardrisk.infrastructure.cache;

import com.example.hazardrisk.domain.model.CategoryStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON file holding precomputed category statistics.
 * <p>
 * A snapshot is either used whole or not at all: any read, decode or validation
 * problem makes {@link #load} return empty, and the caller recomputes live.
 */
public class AggregateSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(AggregateSnapshotStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public AggregateSnapshotStore(Path path, ObjectMapper objectMapper, boolean enabled) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    /**
     * Reads the snapshot if it exists, decodes, has the current schema version and
     * covers every category in {@code requiredCategories}.
     */
    public Optional<AggregateSnapshot> load(Collection<String> requiredCategories) {
        if (!enabled || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        AggregateSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(path.toFile(), AggregateSnapshot.class);
        } catch (IOException e) {
            log.warn("event=snapshot_discarded path={} reason=unreadable msg={}", path, e.getMessage());
            return Optional.empty();
        }
        String problem = validate(snapshot, requiredCategories);
        if (problem != null) {
            log.warn("event=snapshot_discarded path={} reason={}", path, problem);
            return Optional.empty();
        }
        log.info("event=snapshot_loaded path={} categories={} generatedAt={}",
                path, snapshot.categories().size(), snapshot.generatedAt());
        return Optional.of(snapshot);
    }

    /**
     * Writes to a sibling temp file and moves it into place so readers never see a
     * half-written document. Failures are logged; the snapshot is only an accelerator.
     */
    public void save(AggregateSnapshot snapshot) {
        if (!enabled) {
            return;
        }
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("event=snapshot_saved path={} categories={}", path, snapshot.categories().size());
        } catch (IOException e) {
            log.warn("event=snapshot_save_failed path={} msg={}", path, e.getMessage());
        }
    }

    private static String validate(AggregateSnapshot snapshot, Collection<String> requiredCategories) {
        if (snapshot == null) {
            return "empty_document";
        }
        if (snapshot.schemaVersion() != AggregateSnapshot.CURRENT_SCHEMA_VERSION) {
            return "schema_version_" + snapshot.schemaVersion();
        }
        Map<String, CategoryStats> categories = snapshot.categories();
        if (categories == null) {
            return "missing_categories";
        }
        for (String category : requiredCategories) {
            CategoryStats stats = categories.get(category);
            if (stats == null) {
                return "missing_category";
            }
            if (stats.topSources() == null || stats.topBodyParts() == null || stats.yearBreakdown() == null) {
                return "incomplete_category";
            }
        }
        return null;
    }
}
