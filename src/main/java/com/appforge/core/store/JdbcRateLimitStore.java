package com.appforge.core.store;

import com.appforge.core.ratelimit.RateLimitStore;
import com.appforge.core.ratelimit.RateLimitWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rate-limit windows in a shared table. The increment is a single conditional
 * UPDATE, so the limit holds across every process pointed at the same database.
 */
public class JdbcRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRateLimitStore.class);

    private static final String TABLE_NAME = "rate_limit_windows";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                operation_type VARCHAR(64) NOT NULL PRIMARY KEY,
                window_start   BIGINT NOT NULL,
                request_count  INTEGER NOT NULL,
                window_limit   INTEGER NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT operation_type, window_start, request_count, window_limit
            FROM %s
            WHERE operation_type = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT operation_type, window_start, request_count, window_limit
            FROM %s
            ORDER BY operation_type
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (operation_type, window_start, request_count, window_limit)
            VALUES (?, ?, 0, ?)
            """.formatted(TABLE_NAME);

    private static final String RESET_SQL = """
            UPDATE %s
            SET window_start = ?, request_count = 0, window_limit = ?
            WHERE operation_type = ? AND window_start = ?
            """.formatted(TABLE_NAME);

    private static final String INCREMENT_SQL = """
            UPDATE %s
            SET request_count = request_count + 1
            WHERE operation_type = ? AND window_start = ? AND request_count < ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_OLD_SQL = """
            DELETE FROM %s WHERE window_start < ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcRateLimitStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Rate limit table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<RateLimitWindow> find(String operationType) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, operationType);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read rate limit window for " + operationType, e);
        }
    }

    @Override
    public boolean openWindow(String operationType, Instant expectedStart, Instant newStart, int limit) {
        try (Connection conn = dataSource.getConnection()) {
            if (expectedStart == null) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    stmt.setString(1, operationType);
                    JdbcSupport.setInstant(stmt, 2, newStart);
                    stmt.setInt(3, limit);
                    return stmt.executeUpdate() == 1;
                } catch (SQLException e) {
                    if (JdbcSupport.isDuplicateKey(e)) {
                        return false;
                    }
                    throw e;
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(RESET_SQL)) {
                JdbcSupport.setInstant(stmt, 1, newStart);
                stmt.setInt(2, limit);
                stmt.setString(3, operationType);
                JdbcSupport.setInstant(stmt, 4, expectedStart);
                return stmt.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to open rate limit window for " + operationType, e);
        }
    }

    @Override
    public boolean tryIncrement(String operationType, Instant windowStart, int ceiling) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INCREMENT_SQL)) {
            stmt.setString(1, operationType);
            JdbcSupport.setInstant(stmt, 2, windowStart);
            stmt.setInt(3, ceiling);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to increment rate limit for " + operationType, e);
        }
    }

    @Override
    public List<RateLimitWindow> findAll() {
        List<RateLimitWindow> windows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                windows.add(fromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list rate limit windows", e);
        }
        return windows;
    }

    @Override
    public int deleteWindowsStartedBefore(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_OLD_SQL)) {
            JdbcSupport.setInstant(stmt, 1, cutoff);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to purge rate limit windows", e);
        }
    }

    private RateLimitWindow fromResultSet(ResultSet rs) throws SQLException {
        return new RateLimitWindow(
                rs.getString("operation_type"),
                JdbcSupport.getInstant(rs, "window_start"),
                rs.getInt("request_count"),
                rs.getInt("window_limit"));
    }
}
