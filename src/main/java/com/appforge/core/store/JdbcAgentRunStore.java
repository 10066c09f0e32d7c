package com.appforge.core.store;

import com.appforge.core.model.AgentRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs stored as JSON documents, with the stage and timestamps copied into
 * columns for listing.
 */
public class JdbcAgentRunStore implements AgentRunStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentRunStore.class);

    private static final String TABLE_NAME = "agent_runs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         VARCHAR(64) NOT NULL PRIMARY KEY,
                project_id VARCHAR(255) NOT NULL,
                stage      VARCHAR(16) NOT NULL,
                document   TEXT NOT NULL,
                created_at BIGINT NOT NULL,
                updated_at BIGINT NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_%s_updated ON %s (updated_at)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET stage = ?, document = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, project_id, stage, document, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT document FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT document FROM %s ORDER BY updated_at DESC LIMIT ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcAgentRunStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
            log.info("Run table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(AgentRun run) {
        String document = serialize(run);
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, run.stage().name());
                stmt.setString(2, document);
                JdbcSupport.setInstant(stmt, 3, run.updatedAt());
                stmt.setString(4, run.id());
                if (stmt.executeUpdate() == 1) {
                    return;
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, run.id());
                stmt.setString(2, run.projectId());
                stmt.setString(3, run.stage().name());
                stmt.setString(4, document);
                JdbcSupport.setInstant(stmt, 5, run.createdAt());
                JdbcSupport.setInstant(stmt, 6, run.updatedAt());
                stmt.executeUpdate();
            }
            log.debug("Saved run {} at stage {}", run.id(), run.stage());
        } catch (SQLException e) {
            throw new StoreException("Failed to save run " + run.id(), e);
        }
    }

    @Override
    public Optional<AgentRun> findById(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(deserialize(rs.getString("document"))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read run " + runId, e);
        }
    }

    @Override
    public List<AgentRun> findRecent(int limit) {
        List<AgentRun> runs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    runs.add(deserialize(rs.getString("document")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list runs", e);
        }
        return runs;
    }

    private String serialize(AgentRun run) {
        try {
            return objectMapper.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run " + run.id(), e);
        }
    }

    private AgentRun deserialize(String json) {
        try {
            return objectMapper.readValue(json, AgentRun.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize run document", e);
        }
    }
}
