package com.example.hazardrisk.infrastructure.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Operator;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.QueryStringQuery;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.infrastructure.corpus.CorpusUnavailableException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ElasticsearchIncidentSearch implements LexicalSearch {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchIncidentSearch.class);

    private final ElasticsearchClient client;
    private final String indexName;

    public ElasticsearchIncidentSearch(
            ElasticsearchClient client,
            @Value("${hazardrisk.elasticsearch.index}") String indexName
    ) {
        this.client = client;
        this.indexName = indexName;
    }

    public boolean indexExists() {
        try {
            return client.indices().exists(e -> e.index(indexName)).value();
        } catch (IOException e) {
            throw new CorpusUnavailableException("Failed to check Elasticsearch index: " + indexName, e);
        }
    }

    public void ensureIndexExists() {
        if (indexExists()) {
            return;
        }
        try {
            client.indices().create(c -> c
                    .index(indexName)
                    .mappings(m -> {
                        m.properties("id", p -> p.long_(l -> l));
                        m.properties("year", p -> p.integer(i -> i));
                        m.properties("outcome", p -> p.integer(i -> i));
                        m.properties("daysAway", p -> p.integer(i -> i));
                        for (IncidentField f : IncidentField.values()) {
                            m.properties(f.indexField(), p -> p.text(t -> t));
                        }
                        return m;
                    })
                    .settings(s -> s
                            .numberOfShards("1")
                            .numberOfReplicas("0")
                    )
            );
            log.info("event=es_index_created index={}", indexName);
        } catch (IOException e) {
            throw new CorpusUnavailableException("Failed to ensure Elasticsearch index exists: " + indexName, e);
        }
    }

    /**
     * Indexes (or overwrites) the given incidents, keyed by incident id.
     *
     * @return number of documents the cluster accepted
     */
    public int bulkIndex(List<IncidentRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        List<BulkOperation> ops = new ArrayList<>(records.size());
        for (IncidentRecord r : records) {
            Map<String, Object> doc = toDocument(r);
            ops.add(BulkOperation.of(b -> b
                    .index(i -> i
                            .index(indexName)
                            .id(String.valueOf(r.id()))
                            .document(doc)
                    )));
        }

        try {
            BulkRequest request = BulkRequest.of(b -> b.operations(ops));
            BulkResponse resp = client.bulk(request);

            if (resp.errors()) {
                int failed = 0;
                for (var item : resp.items()) {
                    if (item.error() != null) {
                        failed++;
                        log.error("event=es_bulk_item_error id={} reason={}",
                                item.id(),
                                item.error().reason());
                    }
                }
                log.warn("event=es_bulk_index_errors index={} failed={} took={}ms",
                        indexName, failed, resp.took());
                return records.size() - failed;
            }
            log.debug("event=es_bulk_index_ok index={} count={} took={}ms",
                    indexName, records.size(), resp.took());
            return records.size();
        } catch (IOException e) {
            throw new CorpusUnavailableException("Elasticsearch bulk index failed", e);
        }
    }

    @Override
    public List<Long> search(List<String> terms, int limit) {
        if (terms == null || terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        String queryText = buildPrefixQuery(terms);
        List<String> fields = IncidentField.NARRATIVE_FIELDS.stream()
                .map(IncidentField::indexField)
                .collect(Collectors.toList());

        Query query = QueryStringQuery.of(q -> q
                .query(queryText)
                .fields(fields)
                .defaultOperator(Operator.Or)
        )._toQuery();

        try {
            SearchResponse<Map> response = client.search(s -> s
                            .index(indexName)
                            .query(query)
                            .size(limit)
                            .source(src -> src.fetch(false))
                            .sort(so -> so.score(sc -> sc.order(SortOrder.Desc))),
                    Map.class
            );

            List<Long> ids = new ArrayList<>();
            for (Hit<Map> hit : response.hits().hits()) {
                if (hit.id() == null) {
                    continue;
                }
                ids.add(Long.parseLong(hit.id()));
            }

            log.debug("event=es_lexical_search terms={} limit={} returned={}", terms.size(), limit, ids.size());
            return ids;
        } catch (ElasticsearchException e) {
            if (e.status() == 400) {
                throw new MalformedQueryException("Lexical query rejected: " + queryText, e);
            }
            if (e.status() == 404) {
                throw new LexicalIndexMissingException("Lexical index not found: " + indexName, e);
            }
            throw new CorpusUnavailableException("Elasticsearch lexical search failed", e);
        } catch (IOException e) {
            throw new CorpusUnavailableException("Elasticsearch lexical search failed", e);
        }
    }

    /**
     * {@code ["floor", "hole"]} becomes {@code floor* OR hole*}. Terms are passed
     * through unescaped, so query syntax inside a term surfaces as a parse error.
     */
    static String buildPrefixQuery(List<String> terms) {
        return terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t + "*")
                .collect(Collectors.joining(" OR "));
    }

    static Map<String, Object> toDocument(IncidentRecord r) {
        Map<String, Object> doc = new HashMap<>();
        doc.put("id", r.id());
        doc.put("year", r.year());
        doc.put("outcome", r.outcome().code());
        doc.put("daysAway", r.daysAway());
        for (IncidentField f : IncidentField.values()) {
            String v = r.valueOf(f);
            if (v != null) {
                doc.put(f.indexField(), v);
            }
        }
        return doc;
    }
}
