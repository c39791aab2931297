package com.example.hazardrisk.infrastructure.search;

import java.util.List;

/**
 * Ranked full-text search over the incident narrative fields.
 */
public interface LexicalSearch {

    /**
     * Incident ids matching any of {@code terms} as a prefix, best match first.
     *
     * @throws MalformedQueryException if the engine cannot parse the query
     * @throws com.example.hazardrisk.infrastructure.corpus.CorpusUnavailableException if the index cannot be reached
     */
    List<Long> search(List<String> terms, int limit);
}
