package com.appforge.core.store;

import com.appforge.core.queue.JobPriority;
import com.appforge.core.queue.JobStatus;
import com.appforge.core.queue.JobStore;
import com.appforge.core.queue.PendingJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending-job table. Every status change is an UPDATE guarded by the current
 * status, which is what makes a claim exclusive across sweepers.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String TABLE_NAME = "pending_jobs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id             VARCHAR(64) NOT NULL PRIMARY KEY,
                operation_type VARCHAR(64) NOT NULL,
                action         VARCHAR(64) NOT NULL,
                payload        TEXT NOT NULL,
                priority       INTEGER NOT NULL,
                enqueued_at    BIGINT NOT NULL,
                attempts       INTEGER NOT NULL,
                max_attempts   INTEGER NOT NULL,
                status         VARCHAR(16) NOT NULL,
                last_error     TEXT,
                claimed_at     BIGINT,
                finished_at    BIGINT
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_%s_sweep ON %s (status, operation_type, priority, enqueued_at)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String COLUMNS = """
            id, operation_type, action, payload, priority, enqueued_at, attempts, max_attempts,
            status, last_error, claimed_at, finished_at""";

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_PENDING_SQL = """
            SELECT %s FROM %s
            WHERE status = 'PENDING'
            ORDER BY operation_type, priority, enqueued_at, id
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String CLAIM_SQL = """
            UPDATE %s SET status = 'PROCESSING', claimed_at = ?
            WHERE id = ? AND status = 'PENDING'
            """.formatted(TABLE_NAME);

    private static final String COMPLETE_SQL = """
            UPDATE %s SET status = 'COMPLETED', claimed_at = NULL, finished_at = ?
            WHERE id = ? AND status = 'PROCESSING'
            """.formatted(TABLE_NAME);

    private static final String RELEASE_SQL = """
            UPDATE %s SET status = 'PENDING', claimed_at = NULL
            WHERE id = ? AND status = 'PROCESSING'
            """.formatted(TABLE_NAME);

    private static final String FAILURE_SQL = """
            UPDATE %s SET status = ?, attempts = ?, last_error = ?, claimed_at = NULL, finished_at = ?
            WHERE id = ? AND status = 'PROCESSING'
            """.formatted(TABLE_NAME);

    private static final String REQUEUE_STALE_SQL = """
            UPDATE %s SET status = 'PENDING', claimed_at = NULL
            WHERE status = 'PROCESSING' AND claimed_at < ?
            """.formatted(TABLE_NAME);

    private static final String COUNT_SQL = """
            SELECT status, COUNT(*) AS total FROM %s GROUP BY status
            """.formatted(TABLE_NAME);

    private static final String OLDEST_PENDING_SQL = """
            SELECT MIN(enqueued_at) AS oldest FROM %s WHERE status = 'PENDING'
            """.formatted(TABLE_NAME);

    private static final String DELETE_FINISHED_SQL = """
            DELETE FROM %s WHERE id IN (
                SELECT id FROM %s
                WHERE status IN ('COMPLETED', 'FAILED') AND finished_at < ?
                ORDER BY finished_at
                LIMIT ?
            )
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcJobStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
            log.info("Job table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void insert(PendingJob job) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, job.id());
            stmt.setString(2, job.operationType());
            stmt.setString(3, job.action());
            stmt.setString(4, serializePayload(job.payload()));
            stmt.setInt(5, job.priority().rank());
            JdbcSupport.setInstant(stmt, 6, job.enqueuedAt());
            stmt.setInt(7, job.attempts());
            stmt.setInt(8, job.maxAttempts());
            stmt.setString(9, job.status().name());
            JdbcSupport.setNullableString(stmt, 10, job.lastError());
            JdbcSupport.setInstant(stmt, 11, job.claimedAt());
            JdbcSupport.setInstant(stmt, 12, job.finishedAt());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert job " + job.id(), e);
        }
    }

    @Override
    public Optional<PendingJob> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read job " + id, e);
        }
    }

    @Override
    public List<PendingJob> findPending() {
        List<PendingJob> jobs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PENDING_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                jobs.add(fromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list pending jobs", e);
        }
        return jobs;
    }

    @Override
    public boolean claim(String id, Instant now) {
        return update(CLAIM_SQL, "claim " + id, stmt -> {
            JdbcSupport.setInstant(stmt, 1, now);
            stmt.setString(2, id);
        }) == 1;
    }

    @Override
    public boolean complete(String id, Instant now) {
        return update(COMPLETE_SQL, "complete " + id, stmt -> {
            JdbcSupport.setInstant(stmt, 1, now);
            stmt.setString(2, id);
        }) == 1;
    }

    @Override
    public boolean release(String id) {
        return update(RELEASE_SQL, "release " + id, stmt -> stmt.setString(1, id)) == 1;
    }

    @Override
    public boolean recordFailure(String id, int attempts, String error, boolean terminal, Instant now) {
        return update(FAILURE_SQL, "record failure for " + id, stmt -> {
            stmt.setString(1, (terminal ? JobStatus.FAILED : JobStatus.PENDING).name());
            stmt.setInt(2, attempts);
            JdbcSupport.setNullableString(stmt, 3, error);
            JdbcSupport.setInstant(stmt, 4, terminal ? now : null);
            stmt.setString(5, id);
        }) == 1;
    }

    @Override
    public int requeueStale(Instant claimedBefore) {
        return update(REQUEUE_STALE_SQL, "requeue stale jobs",
                stmt -> JdbcSupport.setInstant(stmt, 1, claimedBefore));
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        var counts = new EnumMap<JobStatus, Long>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getLong("total"));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs", e);
        }
        return counts;
    }

    @Override
    public Optional<Instant> oldestPendingEnqueuedAt() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(OLDEST_PENDING_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? Optional.ofNullable(JdbcSupport.getInstant(rs, "oldest")) : Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to read oldest pending job", e);
        }
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff, int limit) {
        return update(DELETE_FINISHED_SQL, "delete finished jobs", stmt -> {
            JdbcSupport.setInstant(stmt, 1, cutoff);
            stmt.setInt(2, limit);
        });
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private int update(String sql, String description, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to " + description, e);
        }
    }

    private String serializePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job payload", e);
        }
    }

    private Map<String, Object> deserializePayload(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize job payload", e);
        }
    }

    private PendingJob fromResultSet(ResultSet rs) throws SQLException {
        return new PendingJob(
                rs.getString("id"),
                rs.getString("operation_type"),
                rs.getString("action"),
                deserializePayload(rs.getString("payload")),
                JobPriority.fromRank(rs.getInt("priority")),
                JdbcSupport.getInstant(rs, "enqueued_at"),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getString("last_error"),
                JdbcSupport.getInstant(rs, "claimed_at"),
                JdbcSupport.getInstant(rs, "finished_at"));
    }
}
