package org.carball.pgmaint.catalog;

import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.execution.Rows;
import org.carball.pgmaint.execution.SqlExecutor;
import org.carball.pgmaint.model.query.QueryStats;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads statement statistics from the {@code pg_stat_statements} extension.
 * The view keeps no per-statement execution time, so {@code lastExecuted} is always empty.
 */
public class PostgresQueryStatisticsReader implements QueryStatisticsSource {

    static final String EXTENSION_INSTALLED =
            "SELECT 1 AS installed FROM pg_extension WHERE extname = 'pg_stat_statements'";

    static final String SLOW_STATEMENTS = """
            SELECT query,
                   mean_exec_time,
                   calls,
                   rows
            FROM pg_stat_statements
            WHERE mean_exec_time > ?
            ORDER BY mean_exec_time DESC
            LIMIT ?
            """;

    private final SqlExecutor executor;

    public PostgresQueryStatisticsReader(SqlExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Tests whether pg_stat_statements is installed in the connected database.
     */
    public boolean isStatementStatisticsAvailable(CancellationSignal signal) throws CatalogReadException {
        try {
            return !executor.queryForList(EXTENSION_INSTALLED, signal).isEmpty();
        } catch (SQLException e) {
            throw new CatalogReadException("Failed to check for pg_stat_statements: " + e.getMessage(), e);
        }
    }

    @Override
    public List<QueryStats> queryStatistics(double minMeanDurationMs, int limit, CancellationSignal signal)
            throws CatalogReadException {
        if (!isStatementStatisticsAvailable(signal)) {
            throw new CatalogReadException(
                    "pg_stat_statements is not installed; run CREATE EXTENSION pg_stat_statements "
                            + "and add it to shared_preload_libraries");
        }

        List<Map<String, Object>> rows;
        try {
            rows = executor.queryForList(SLOW_STATEMENTS, signal, minMeanDurationMs, limit);
        } catch (SQLException e) {
            throw new CatalogReadException("Failed to read pg_stat_statements: " + e.getMessage(), e);
        }

        List<QueryStats> results = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            try {
                results.add(new QueryStats(
                        Rows.string(row, "query"),
                        Rows.doubleValue(row, "mean_exec_time"),
                        Rows.longValue(row, "calls"),
                        Rows.longValue(row, "rows"),
                        null));
            } catch (IllegalArgumentException e) {
                throw new CatalogReadException("Unexpected pg_stat_statements row: " + e.getMessage(), e);
            }
        }
        return results;
    }
}
