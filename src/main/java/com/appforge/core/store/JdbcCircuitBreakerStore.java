package com.appforge.core.store;

import com.appforge.core.breaker.CircuitBreakerState;
import com.appforge.core.breaker.CircuitBreakerStore;
import com.appforge.core.breaker.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Breaker state shared through one row per breaker, updated by version compare-and-set.
 */
public class JdbcCircuitBreakerStore implements CircuitBreakerStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCircuitBreakerStore.class);

    private static final String TABLE_NAME = "circuit_breakers";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                name                 VARCHAR(64) NOT NULL PRIMARY KEY,
                state                VARCHAR(16) NOT NULL,
                consecutive_failures INTEGER NOT NULL,
                opened_at            BIGINT,
                next_probe_at        BIGINT,
                probe_in_flight      BOOLEAN NOT NULL,
                probe_started_at     BIGINT,
                reopen_count         INTEGER NOT NULL,
                version              BIGINT NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT name, state, consecutive_failures, opened_at, next_probe_at,
                   probe_in_flight, probe_started_at, reopen_count, version
            FROM %s
            WHERE name = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (name, state, consecutive_failures, opened_at, next_probe_at,
                            probe_in_flight, probe_started_at, reopen_count, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String CAS_SQL = """
            UPDATE %s
            SET state = ?, consecutive_failures = ?, opened_at = ?, next_probe_at = ?,
                probe_in_flight = ?, probe_started_at = ?, reopen_count = ?, version = ?
            WHERE name = ? AND version = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcCircuitBreakerStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Circuit breaker table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public CircuitBreakerState load(String name) {
        try (Connection conn = dataSource.getConnection()) {
            Optional<CircuitBreakerState> existing = select(conn, name);
            if (existing.isPresent()) {
                return existing.get();
            }
            CircuitBreakerState initial = CircuitBreakerState.initial(name);
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, name);
                bindState(stmt, 2, initial);
                stmt.executeUpdate();
                return initial;
            } catch (SQLException e) {
                if (!JdbcSupport.isDuplicateKey(e)) {
                    throw e;
                }
                // Another process created the row between our select and insert
                return select(conn, name).orElseThrow(() -> e);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load circuit breaker " + name, e);
        }
    }

    @Override
    public boolean compareAndSet(CircuitBreakerState expected, CircuitBreakerState next) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CAS_SQL)) {
            int index = bindState(stmt, 1, next);
            stmt.setString(index, expected.name());
            stmt.setLong(index + 1, expected.version());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update circuit breaker " + expected.name(), e);
        }
    }

    private Optional<CircuitBreakerState> select(Connection conn, String name) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CircuitBreakerState(
                        rs.getString("name"),
                        CircuitState.valueOf(rs.getString("state")),
                        rs.getInt("consecutive_failures"),
                        JdbcSupport.getInstant(rs, "opened_at"),
                        JdbcSupport.getInstant(rs, "next_probe_at"),
                        rs.getBoolean("probe_in_flight"),
                        JdbcSupport.getInstant(rs, "probe_started_at"),
                        rs.getInt("reopen_count"),
                        rs.getLong("version")));
            }
        }
    }

    /** Binds every column except the name; returns the next free parameter index. */
    private int bindState(PreparedStatement stmt, int start, CircuitBreakerState s) throws SQLException {
        stmt.setString(start, s.state().name());
        stmt.setInt(start + 1, s.consecutiveFailures());
        JdbcSupport.setInstant(stmt, start + 2, s.openedAt());
        JdbcSupport.setInstant(stmt, start + 3, s.nextProbeAt());
        stmt.setBoolean(start + 4, s.probeInFlight());
        JdbcSupport.setInstant(stmt, start + 5, s.probeStartedAt());
        stmt.setInt(start + 6, s.reopenCount());
        stmt.setLong(start + 7, s.version());
        return start + 8;
    }
}
