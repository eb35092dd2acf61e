package org.carball.pgmaint.execution;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * {@link SqlExecutor} over plain JDBC. Every call borrows its own connection, so concurrent callers never
 * share a transaction.
 */
@Slf4j
public class JdbcSqlExecutor implements SqlExecutor {

    // PostgreSQL "query_canceled", raised when a statement timeout or Statement.cancel() fires
    private static final String QUERY_CANCELED = "57014";

    private final ConnectionSource connections;

    public JdbcSqlExecutor(String url, String user, String password) {
        this(() -> DriverManager.getConnection(url, user, password));
    }

    public JdbcSqlExecutor(DataSource dataSource) {
        this(dataSource::getConnection);
    }

    JdbcSqlExecutor(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public List<Map<String, Object>> queryForList(String sql, CancellationSignal signal, Object... params)
            throws SQLException {
        signal.throwIfCancelled("query");
        List<Map<String, Object>> rows = new ArrayList<>();

        try (Connection conn = connections.open();
             PreparedStatement stmt = conn.prepareStatement(sql);
             CancellationSignal.Registration ignored = signal.onCancel(() -> cancelQuietly(stmt))) {

            stmt.setQueryTimeout(signal.remainingTimeoutSeconds());
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }

            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columnCount = meta.getColumnCount();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int col = 1; col <= columnCount; col++) {
                        row.put(meta.getColumnLabel(col).toLowerCase(Locale.ROOT), convert(rs.getObject(col)));
                    }
                    rows.add(row);
                }
            }
        } catch (SQLException e) {
            throw translateCancellation(e, signal, "query");
        }

        return rows;
    }

    @Override
    public void executeMaintenance(String sql, CancellationSignal signal) throws SQLException {
        signal.throwIfCancelled(sql);

        try (Connection conn = connections.open()) {
            // VACUUM and friends refuse to run inside a transaction block
            if (!conn.getAutoCommit()) {
                conn.setAutoCommit(true);
            }
            try (Statement stmt = conn.createStatement();
                 CancellationSignal.Registration ignored = signal.onCancel(() -> cancelQuietly(stmt))) {
                stmt.setQueryTimeout(signal.remainingTimeoutSeconds());
                log.debug("Executing maintenance statement: {}", sql);
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw translateCancellation(e, signal, sql);
        }
    }

    private SQLException translateCancellation(SQLException e, CancellationSignal signal, String activity) {
        boolean timedOut = e instanceof SQLTimeoutException || QUERY_CANCELED.equals(e.getSQLState());
        if (timedOut && signal.isCancelled()) {
            CancellationException cancellation = new CancellationException(
                    (signal.isExpired() ? "Timed out during " : "Cancelled during ") + activity);
            cancellation.initCause(e);
            throw cancellation;
        }
        return e;
    }

    private static void cancelQuietly(Statement stmt) {
        try {
            stmt.cancel();
        } catch (SQLException e) {
            log.warn("Could not cancel running statement: {}", e.getMessage());
        }
    }

    static Object convert(Object value) throws SQLException {
        if (value instanceof Array array) {
            Object[] elements = (Object[]) array.getArray();
            List<String> values = new ArrayList<>(elements.length);
            for (Object element : elements) {
                values.add(element == null ? null : element.toString());
            }
            return values;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.withOffsetSameInstant(ZoneOffset.UTC);
        }
        return value;
    }

    @FunctionalInterface
    interface ConnectionSource {
        Connection open() throws SQLException;
    }
}
