package com.example.hazardrisk.application.service;

import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.infrastructure.corpus.CorpusUnavailableException;
import com.example.hazardrisk.infrastructure.corpus.IncidentCorpus;
import com.example.hazardrisk.infrastructure.search.ElasticsearchIncidentSearch;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

/**
 * Copies the relational corpus into the lexical index, page by page in id order.
 */
@Service
public class IndexRebuildService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexRebuildService.class);

    private final IncidentCorpus corpus;
    private final ElasticsearchIncidentSearch searchIndex;
    private final int pageSize;
    private final boolean rebuildOnStartup;
    private final boolean rebuildIfMissing;

    public IndexRebuildService(
            IncidentCorpus corpus,
            ElasticsearchIncidentSearch searchIndex,
            @Value("${hazardrisk.elasticsearch.rebuild-page-size:1000}") int pageSize,
            @Value("${hazardrisk.elasticsearch.rebuild-on-startup:false}") boolean rebuildOnStartup,
            @Value("${hazardrisk.elasticsearch.rebuild-if-missing:true}") boolean rebuildIfMissing
    ) {
        this.corpus = corpus;
        this.searchIndex = searchIndex;
        this.pageSize = Math.max(1, pageSize);
        this.rebuildOnStartup = rebuildOnStartup;
        this.rebuildIfMissing = rebuildIfMissing;
    }

    public record RebuildResult(int indexed, int pages, long ms) {
    }

    public RebuildResult rebuild() {
        long t0 = System.nanoTime();
        searchIndex.ensureIndexExists();

        long lastId = Long.MIN_VALUE;
        int indexed = 0;
        int pages = 0;
        while (true) {
            List<IncidentRecord> page = corpus.findPage(lastId, pageSize);
            if (page.isEmpty()) {
                break;
            }
            indexed += searchIndex.bulkIndex(page);
            pages++;
            lastId = page.get(page.size() - 1).id();
            if (page.size() < pageSize) {
                break;
            }
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        log.info("event=lexical_index_rebuilt indexed={} pages={} pageSize={} ms={}", indexed, pages, pageSize, ms);
        return new RebuildResult(indexed, pages, ms);
    }

    /**
     * Rebuilds at startup when asked to, or when the lexical index does not exist
     * yet. An unreachable cluster is logged and left to the substring fallback.
     */
    @Override
    public void run(ApplicationArguments args) {
        try {
            if (rebuildOnStartup) {
                rebuild();
            } else if (rebuildIfMissing && !searchIndex.indexExists()) {
                log.info("event=lexical_index_missing action=rebuild");
                rebuild();
            }
        } catch (CorpusUnavailableException e) {
            log.warn("event=lexical_index_startup_failed msg={}", e.getMessage());
        }
    }
}
