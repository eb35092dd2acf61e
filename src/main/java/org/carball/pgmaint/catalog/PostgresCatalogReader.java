package org.carball.pgmaint.catalog;

import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.execution.Rows;
import org.carball.pgmaint.execution.SqlExecutor;
import org.carball.pgmaint.model.catalog.ForeignKeyColumn;
import org.carball.pgmaint.model.catalog.IndexInfo;
import org.carball.pgmaint.model.catalog.IndexKey;
import org.carball.pgmaint.model.catalog.IndexUsage;
import org.carball.pgmaint.model.catalog.TableStats;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads indexes, constraints and statistics from the PostgreSQL system catalogs.
 */
public class PostgresCatalogReader implements CatalogReader {

    // One entry per key position (INCLUDE columns are past indnkeyatts). Expression keys have attnum 0 and are
    // rendered with pg_get_indexdef so they keep their place in the list.
    private static final String INDEX_COLUMNS = """
            ARRAY(
                SELECT CASE WHEN k.attnum = 0
                            THEN pg_get_indexdef(ix.indexrelid, k.ord::int, true)
                            ELSE a.attname::text
                       END
                FROM unnest(ix.indkey::int2[]) WITH ORDINALITY AS k(attnum, ord)
                LEFT JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = k.attnum
                WHERE k.ord <= ix.indnkeyatts
                ORDER BY k.ord
            )""";

    static final String LIST_INDEXES = """
            SELECT t.relname AS table_name,
                   i.relname AS index_name,
                   am.amname AS index_type,
                   ix.indisunique AS is_unique,
                   ix.indisprimary AS is_primary,
                   pg_relation_size(i.oid) AS size_bytes,
                   %s AS columns,
                   (to_jsonb(s) ->> 'last_idx_scan')::timestamptz AS last_used
            FROM pg_index ix
            JOIN pg_class i ON i.oid = ix.indexrelid
            JOIN pg_class t ON t.oid = ix.indrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            JOIN pg_am am ON am.oid = i.relam
            LEFT JOIN pg_stat_user_indexes s ON s.indexrelid = ix.indexrelid
            WHERE n.nspname = ?
              AND t.relkind IN ('r', 'p', 'm')
              AND t.relname NOT LIKE 'pg\\_%%'
            ORDER BY t.relname, i.relname
            """.formatted(INDEX_COLUMNS);

    static final String TABLE_INDEX_COLUMNS = """
            SELECT i.relname AS index_name,
                   %s AS columns
            FROM pg_index ix
            JOIN pg_class i ON i.oid = ix.indexrelid
            JOIN pg_class t ON t.oid = ix.indrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            WHERE n.nspname = ?
              AND t.relname = ?
            """.formatted(INDEX_COLUMNS);

    static final String INDEX_USAGE = """
            SELECT relname AS table_name,
                   indexrelname AS index_name,
                   idx_scan
            FROM pg_stat_user_indexes
            WHERE schemaname = ?
            """;

    static final String TABLE_STATISTICS = """
            SELECT relname AS table_name,
                   n_tup_ins, n_tup_upd, n_tup_del,
                   n_live_tup, n_dead_tup,
                   last_vacuum, last_autovacuum,
                   last_analyze, last_autoanalyze
            FROM pg_stat_user_tables
            WHERE schemaname = ?
            ORDER BY relname
            """;

    static final String FOREIGN_KEY_COLUMNS = """
            SELECT c.conname AS constraint_name,
                   t.relname AS table_name,
                   a.attname AS column_name,
                   rt.relname AS referenced_table,
                   ra.attname AS referenced_column,
                   k.ord AS position
            FROM pg_constraint c
            JOIN pg_class t ON t.oid = c.conrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            JOIN pg_class rt ON rt.oid = c.confrelid
            CROSS JOIN LATERAL unnest(c.conkey, c.confkey) WITH ORDINALITY AS k(attnum, ref_attnum, ord)
            JOIN pg_attribute a ON a.attrelid = c.conrelid AND a.attnum = k.attnum
            JOIN pg_attribute ra ON ra.attrelid = c.confrelid AND ra.attnum = k.ref_attnum
            WHERE c.contype = 'f'
              AND n.nspname = ?
            ORDER BY t.relname, c.conname, k.ord
            """;

    static final String TABLE_SIZES = """
            SELECT c.relname AS table_name,
                   pg_total_relation_size(c.oid) AS total_bytes
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relkind IN ('r', 'p', 'm')
            ORDER BY total_bytes DESC, c.relname
            """;

    private final SqlExecutor executor;
    private final String schema;

    public PostgresCatalogReader(SqlExecutor executor, String schema) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public String getSchema() {
        return schema;
    }

    @Override
    public List<IndexInfo> listIndexes(CancellationSignal signal) throws CatalogReadException {
        return read("indexes", LIST_INDEXES, signal, row -> new IndexInfo(
                Rows.requiredString(row, "table_name"),
                Rows.requiredString(row, "index_name"),
                Rows.stringList(row, "columns"),
                Rows.string(row, "index_type"),
                Rows.bool(row, "is_unique"),
                Rows.bool(row, "is_primary"),
                Rows.longValue(row, "size_bytes"),
                Rows.timestamp(row, "last_used")), schema);
    }

    @Override
    public IndexUsage indexUsage(CancellationSignal signal) throws CatalogReadException {
        Map<IndexKey, Long> scans = new LinkedHashMap<>();
        for (Map<String, Object> row : query("index usage", INDEX_USAGE, signal, schema)) {
            try {
                scans.put(new IndexKey(Rows.requiredString(row, "table_name"), Rows.requiredString(row, "index_name")),
                        Rows.longValue(row, "idx_scan"));
            } catch (IllegalArgumentException e) {
                throw malformed("index usage", e);
            }
        }
        return new IndexUsage(scans);
    }

    @Override
    public Map<String, TableStats> tableStatistics(CancellationSignal signal) throws CatalogReadException {
        Map<String, TableStats> stats = new LinkedHashMap<>();
        for (Map<String, Object> row : query("table statistics", TABLE_STATISTICS, signal, schema)) {
            try {
                stats.put(Rows.requiredString(row, "table_name"), new TableStats(
                        Rows.longValue(row, "n_tup_ins"),
                        Rows.longValue(row, "n_tup_upd"),
                        Rows.longValue(row, "n_tup_del"),
                        Rows.longValue(row, "n_live_tup"),
                        Rows.longValue(row, "n_dead_tup"),
                        Rows.timestamp(row, "last_vacuum"),
                        Rows.timestamp(row, "last_autovacuum"),
                        Rows.timestamp(row, "last_analyze"),
                        Rows.timestamp(row, "last_autoanalyze")));
            } catch (IllegalArgumentException e) {
                throw malformed("table statistics", e);
            }
        }
        return stats;
    }

    @Override
    public List<ForeignKeyColumn> foreignKeyColumns(CancellationSignal signal) throws CatalogReadException {
        return read("foreign keys", FOREIGN_KEY_COLUMNS, signal, row -> new ForeignKeyColumn(
                Rows.requiredString(row, "constraint_name"),
                Rows.requiredString(row, "table_name"),
                Rows.requiredString(row, "column_name"),
                Rows.requiredString(row, "referenced_table"),
                Rows.requiredString(row, "referenced_column"),
                (int) Rows.longValue(row, "position")), schema);
    }

    @Override
    public boolean indexCoversColumns(String table, List<String> columns, CancellationSignal signal)
            throws CatalogReadException {
        List<List<String>> indexColumns = read("indexes of " + table, TABLE_INDEX_COLUMNS, signal,
                row -> Rows.stringList(row, "columns"), schema, table);
        return indexColumns.stream()
                .anyMatch(keyColumns -> keyColumns.size() >= columns.size()
                        && !columns.isEmpty()
                        && keyColumns.subList(0, columns.size()).containsAll(columns));
    }

    @Override
    public Map<String, Long> tableSizes(CancellationSignal signal) throws CatalogReadException {
        Map<String, Long> sizes = new LinkedHashMap<>();
        for (Map<String, Object> row : query("table sizes", TABLE_SIZES, signal, schema)) {
            try {
                sizes.put(Rows.requiredString(row, "table_name"), Rows.longValue(row, "total_bytes"));
            } catch (IllegalArgumentException e) {
                throw malformed("table sizes", e);
            }
        }
        return sizes;
    }

    private <T> List<T> read(String what, String sql, CancellationSignal signal,
                             Function<Map<String, Object>, T> mapper, Object... params) throws CatalogReadException {
        List<T> results = new ArrayList<>();
        for (Map<String, Object> row : query(what, sql, signal, params)) {
            try {
                results.add(mapper.apply(row));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw malformed(what, e);
            }
        }
        return results;
    }

    private List<Map<String, Object>> query(String what, String sql, CancellationSignal signal, Object... params)
            throws CatalogReadException {
        try {
            return executor.queryForList(sql, signal, params);
        } catch (SQLException e) {
            throw new CatalogReadException("Failed to read " + what + " of schema " + schema + ": " + e.getMessage(), e);
        }
    }

    private CatalogReadException malformed(String what, RuntimeException e) {
        return new CatalogReadException("Unexpected " + what + " row in schema " + schema + ": " + e.getMessage(), e);
    }
}
