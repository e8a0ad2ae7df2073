/* (C)2026 */
package com.ammann.logquery.store;

import com.ammann.logquery.query.SqlStatement;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * {@link LogStore} backed by the Agroal connection pool.
 *
 * <p>Each call borrows its own connection, binds parameters positionally with
 * {@link PreparedStatement#setObject(int, Object)} and maps every row to an ordered map keyed by
 * column label. Timestamps are returned as {@link java.time.Instant}. The prepared statement is
 * registered with the call's {@link QueryCancellation} while it executes.
 */
@ApplicationScoped
public class JdbcLogStore implements LogStore
{
    private static final Logger LOG = Logger.getLogger(JdbcLogStore.class);

    private final AgroalDataSource dataSource;
    private final int queryTimeoutSeconds;

    @Inject
    public JdbcLogStore(
            AgroalDataSource dataSource,
            @ConfigProperty(name = "logquery.statement-timeout-seconds", defaultValue = "30")
                    int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public StoreResult execute(SqlStatement statement, QueryCancellation cancellation)
            throws SQLException {
        if (Thread.currentThread().isInterrupted() || cancellation.isCancelled()) {
            throw new SQLException("Statement cancelled before execution: " + statement.kind());
        }

        try (Connection connection = dataSource.getConnection();
                PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            if (queryTimeoutSeconds > 0) {
                ps.setQueryTimeout(queryTimeoutSeconds);
            }
            List<Object> parameters = statement.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                ps.setObject(i + 1, parameters.get(i));
            }

            cancellation.register(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<Map<String, Object>> rows = readRows(rs);
                LOG.debugf("%s statement returned %d rows", statement.kind(), rows.size());
                return StoreResult.of(rows);
            } finally {
                cancellation.clear();
            }
        }
    }

    /**
     * Cheap connectivity probe used by the readiness check.
     *
     * @return {@code true} if {@code SELECT 1} succeeds
     * @throws SQLException if no connection can be obtained
     */
    public boolean ping() throws SQLException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement ps = connection.prepareStatement("SELECT 1");
                ResultSet rs = ps.executeQuery()) {
            return rs.next();
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(columns * 2);
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i), toJavaValue(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object toJavaValue(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof java.sql.Time time) {
            return time.toLocalTime();
        }
        return value;
    }
}
