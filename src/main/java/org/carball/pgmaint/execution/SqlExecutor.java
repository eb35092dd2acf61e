package org.carball.pgmaint.execution;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Statement execution against the target database, supplied by the host application.
 * Implementations must be safe for concurrent use by independent callers.
 */
public interface SqlExecutor {

    /**
     * Runs a parameterized read query and returns one map per row, keyed by lower-case column label.
     * SQL arrays are returned as {@code List<String>} and timestamps as {@code OffsetDateTime}.
     */
    List<Map<String, Object>> queryForList(String sql, CancellationSignal signal, Object... params) throws SQLException;

    /**
     * Runs a DDL or maintenance statement (ANALYZE, VACUUM, REINDEX) in auto-commit mode,
     * outside of any transaction the caller may hold.
     */
    void executeMaintenance(String sql, CancellationSignal signal) throws SQLException;
}
