package com.appforge.core.store;

import com.appforge.sandbox.SandboxSession;
import com.appforge.sandbox.SandboxSessionStore;
import com.appforge.sandbox.SandboxStatus;
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
 * Sandbox sessions keyed by id. {@code active_owner} mirrors the owner while the
 * session is PROVISIONING or RUNNING and is NULL otherwise; its unique constraint
 * enforces at most one active session per owner.
 */
public class JdbcSandboxSessionStore implements SandboxSessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSandboxSessionStore.class);

    private static final String TABLE_NAME = "sandbox_sessions";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id              VARCHAR(64) NOT NULL PRIMARY KEY,
                owner_entity_id VARCHAR(255) NOT NULL,
                active_owner    VARCHAR(255) UNIQUE,
                handle          VARCHAR(255),
                image_tag       VARCHAR(128),
                status          VARCHAR(16) NOT NULL,
                created_at      BIGINT NOT NULL,
                last_used_at    BIGINT NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String COLUMNS = "id, owner_entity_id, handle, image_tag, status, created_at, last_used_at";

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, owner_entity_id, active_owner, handle, image_tag, status, created_at, last_used_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ACTIVE_BY_OWNER_SQL = """
            SELECT %s FROM %s WHERE active_owner = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ACTIVE_SQL = """
            SELECT %s FROM %s WHERE active_owner IS NOT NULL ORDER BY created_at
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s
            SET status = ?,
                handle = COALESCE(?, handle),
                active_owner = CASE WHEN ? = 1 THEN owner_entity_id ELSE NULL END,
                last_used_at = ?
            WHERE id = ? AND status = ?
            """.formatted(TABLE_NAME);

    private static final String TRANSFER_SQL = """
            UPDATE %s
            SET owner_entity_id = ?, active_owner = ?, last_used_at = ?
            WHERE id = ? AND active_owner IS NOT NULL
            """.formatted(TABLE_NAME);

    private static final String TOUCH_SQL = """
            UPDATE %s SET last_used_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcSandboxSessionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Sandbox session table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public boolean insert(SandboxSession session) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, session.id());
            stmt.setString(2, session.ownerEntityId());
            JdbcSupport.setNullableString(stmt, 3, session.status().isActive() ? session.ownerEntityId() : null);
            JdbcSupport.setNullableString(stmt, 4, session.handle());
            JdbcSupport.setNullableString(stmt, 5, session.imageTag());
            stmt.setString(6, session.status().name());
            JdbcSupport.setInstant(stmt, 7, session.createdAt());
            JdbcSupport.setInstant(stmt, 8, session.lastUsedAt());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            if (JdbcSupport.isDuplicateKey(e)) {
                log.debug("Owner {} already has an active sandbox", session.ownerEntityId());
                return false;
            }
            throw new StoreException("Failed to insert sandbox session " + session.id(), e);
        }
    }

    @Override
    public Optional<SandboxSession> findById(String id) {
        return selectOne(SELECT_BY_ID_SQL, id);
    }

    @Override
    public Optional<SandboxSession> findActiveByOwner(String ownerEntityId) {
        return selectOne(SELECT_ACTIVE_BY_OWNER_SQL, ownerEntityId);
    }

    @Override
    public List<SandboxSession> findActive() {
        List<SandboxSession> sessions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ACTIVE_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                sessions.add(fromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list active sandbox sessions", e);
        }
        return sessions;
    }

    @Override
    public boolean updateStatus(String id, SandboxStatus expected, SandboxStatus next, String handle, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
            stmt.setString(1, next.name());
            JdbcSupport.setNullableString(stmt, 2, handle);
            stmt.setInt(3, next.isActive() ? 1 : 0);
            JdbcSupport.setInstant(stmt, 4, now);
            stmt.setString(5, id);
            stmt.setString(6, expected.name());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update sandbox session " + id, e);
        }
    }

    @Override
    public boolean transfer(String id, String newOwnerEntityId, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TRANSFER_SQL)) {
            stmt.setString(1, newOwnerEntityId);
            stmt.setString(2, newOwnerEntityId);
            JdbcSupport.setInstant(stmt, 3, now);
            stmt.setString(4, id);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            if (JdbcSupport.isDuplicateKey(e)) {
                return false;
            }
            throw new StoreException("Failed to transfer sandbox session " + id, e);
        }
    }

    @Override
    public void touch(String id, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TOUCH_SQL)) {
            JdbcSupport.setInstant(stmt, 1, now);
            stmt.setString(2, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to touch sandbox session " + id, e);
        }
    }

    private Optional<SandboxSession> selectOne(String sql, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read sandbox session " + key, e);
        }
    }

    private SandboxSession fromResultSet(ResultSet rs) throws SQLException {
        return new SandboxSession(
                rs.getString("id"),
                rs.getString("owner_entity_id"),
                rs.getString("handle"),
                rs.getString("image_tag"),
                SandboxStatus.valueOf(rs.getString("status")),
                JdbcSupport.getInstant(rs, "created_at"),
                JdbcSupport.getInstant(rs, "last_used_at"));
    }
}
