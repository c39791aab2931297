package com.example.hazardrisk.infrastructure.corpus;

import com.example.hazardrisk.domain.model.IncidentField;
import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.domain.model.OutcomeCode;
import com.example.hazardrisk.domain.model.ValueCount;
import com.example.hazardrisk.domain.query.CategoryPredicateSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Incident corpus backed by the relational {@code incidents} table.
 * <p>
 * The table is loaded once by the ingestion job and only read here, so no
 * statement takes locks or runs inside a transaction.
 */
@Repository
public class JdbcIncidentCorpus implements IncidentCorpus, CorpusAggregates {

    private static final Logger log = LoggerFactory.getLogger(JdbcIncidentCorpus.class);

    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]{0,63}$");
    private static final int ID_BATCH = 500;

    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private final IncidentRowMapper rowMapper = new IncidentRowMapper();

    public JdbcIncidentCorpus(
            JdbcTemplate jdbcTemplate,
            @Value("${hazardrisk.corpus.table:incidents}") String table
    ) {
        if (table == null || !SAFE_TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid corpus table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
    }

    @Override
    public List<Long> findIdsMatching(CategoryPredicateSet predicates, int limit) {
        if (predicates == null || predicates.isEmpty() || limit <= 0) {
            return List.of();
        }
        return selectIds(SqlFilter.of(predicates), limit);
    }

    @Override
    public List<Long> findIdsContaining(String text, Set<IncidentField> fields, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        return selectIds(SqlFilter.containsAny(text, fields), limit);
    }

    private List<Long> selectIds(SqlFilter filter, int limit) {
        String sql = "SELECT id FROM " + table + " WHERE " + filter.clause() + " LIMIT ?";
        return run("select_ids", () -> jdbcTemplate.queryForList(sql, Long.class, filter.paramsWith(limit)));
    }

    @Override
    public List<IncidentRecord> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Long> all = new ArrayList<>(ids);
        List<IncidentRecord> out = new ArrayList<>(all.size());
        for (int from = 0; from < all.size(); from += ID_BATCH) {
            List<Long> batch = all.subList(from, Math.min(all.size(), from + ID_BATCH));
            String placeholders = String.join(",", Collections.nCopies(batch.size(), "?"));
            String sql = "SELECT " + IncidentRowMapper.COLUMNS + " FROM " + table
                    + " WHERE id IN (" + placeholders + ")";
            out.addAll(run("find_by_ids", () -> jdbcTemplate.query(sql, rowMapper, batch.toArray())));
        }
        return out;
    }

    @Override
    public List<IncidentRecord> findPage(long afterId, int limit) {
        String sql = "SELECT " + IncidentRowMapper.COLUMNS + " FROM " + table
                + " WHERE id > ? ORDER BY id LIMIT ?";
        return run("find_page", () -> jdbcTemplate.query(sql, rowMapper, afterId, limit));
    }

    @Override
    public long count(CategoryPredicateSet predicates) {
        return countWhere(SqlFilter.of(predicates));
    }

    @Override
    public long countFatal(CategoryPredicateSet predicates) {
        return countWhere(SqlFilter.of(predicates).and("incident_outcome = ?", OutcomeCode.FATAL.code()));
    }

    @Override
    public long countSevere(CategoryPredicateSet predicates) {
        return countWhere(SqlFilter.of(predicates).and("dafw_num_away >= ?", SEVERE_DAYS_THRESHOLD));
    }

    @Override
    public long countDaysAwayCases(CategoryPredicateSet predicates) {
        return countWhere(SqlFilter.of(predicates).and("incident_outcome = ?", OutcomeCode.DAYS_AWAY.code()));
    }

    @Override
    public double averageDaysAway(CategoryPredicateSet predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return 0.0;
        }
        SqlFilter filter = SqlFilter.of(predicates).and("dafw_num_away > 0");
        String sql = "SELECT AVG(dafw_num_away) FROM " + table + " WHERE " + filter.clause();
        Double avg = run("avg_days_away", () -> jdbcTemplate.queryForObject(sql, Double.class, filter.paramsWith()));
        return avg == null ? 0.0 : avg;
    }

    @Override
    public int maxDaysAway(CategoryPredicateSet predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return 0;
        }
        SqlFilter filter = SqlFilter.of(predicates);
        String sql = "SELECT MAX(dafw_num_away) FROM " + table + " WHERE " + filter.clause();
        Integer max = run("max_days_away", () -> jdbcTemplate.queryForObject(sql, Integer.class, filter.paramsWith()));
        return max == null ? 0 : max;
    }

    @Override
    public List<ValueCount> topValues(IncidentField field, CategoryPredicateSet predicates, int limit) {
        if (predicates == null || predicates.isEmpty() || limit <= 0) {
            return List.of();
        }
        String col = field.column();
        SqlFilter filter = SqlFilter.of(predicates).and(col + " IS NOT NULL AND " + col + " <> ''");
        String sql = "SELECT " + col + " AS val, COUNT(*) AS n FROM " + table
                + " WHERE " + filter.clause()
                + " GROUP BY " + col + " ORDER BY n DESC, " + col + " ASC LIMIT ?";
        return run("top_values", () -> jdbcTemplate.query(sql,
                (rs, i) -> new ValueCount(rs.getString("val"), rs.getLong("n")),
                filter.paramsWith(limit)));
    }

    @Override
    public Map<Integer, Long> yearBreakdown(CategoryPredicateSet predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return Map.of();
        }
        SqlFilter filter = SqlFilter.of(predicates).and("year_filing_for IS NOT NULL");
        String sql = "SELECT year_filing_for AS yr, COUNT(*) AS n FROM " + table
                + " WHERE " + filter.clause()
                + " GROUP BY year_filing_for ORDER BY year_filing_for";
        List<Map.Entry<Integer, Long>> rows = run("year_breakdown", () -> jdbcTemplate.query(sql,
                (rs, i) -> Map.entry(rs.getInt("yr"), rs.getLong("n")),
                filter.paramsWith()));
        Map<Integer, Long> out = new LinkedHashMap<>();
        rows.forEach(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }

    private long countWhere(SqlFilter filter) {
        if (filter.clause().startsWith(SqlFilter.NONE)) {
            return 0L;
        }
        String sql = "SELECT COUNT(*) FROM " + table + " WHERE " + filter.clause();
        Long n = run("count", () -> jdbcTemplate.queryForObject(sql, Long.class, filter.paramsWith()));
        return n == null ? 0L : n;
    }

    private <T> T run(String op, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("event=corpus_query_failed op={} table={} msg={}", op, table, e.getMessage());
            throw new CorpusUnavailableException("Incident corpus unavailable (" + op + ")", e);
        }
    }
}
