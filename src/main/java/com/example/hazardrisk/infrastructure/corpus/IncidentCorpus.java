package com.example.hazardrisk.infrastructure.corpus;

import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read-only record access to the incident corpus.
 * <p>
 * All methods throw {@link CorpusUnavailableException} when the store cannot be
 * reached; "nothing matched" is always an empty list.
 */
public interface IncidentCorpus {

    List<Long> findIdsMatching(CategoryPredicateSet predicates, int limit);

    /**
     * Ids of records where any of {@code fields} contains {@code text}
     * (case-insensitive, literal substring).
     */
    List<Long> findIdsContaining(String text, Set<IncidentField> fields, int limit);

    List<IncidentRecord> findByIds(Collection<Long> ids);

    /**
     * Records with id greater than {@code afterId}, ascending by id.
     */
    List<IncidentRecord> findPage(long afterId, int limit);
}
