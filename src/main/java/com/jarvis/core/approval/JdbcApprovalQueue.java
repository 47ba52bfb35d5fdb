package com.jarvis.core.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;
import com.jarvis.core.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link ApprovalQueue} over the {@code approvals} table.
 * <p>
 * A decision is a single conditional {@code UPDATE ... WHERE decision IS NULL},
 * so the database arbitrates concurrent decisions on the same record. JSON-valued
 * columns are stored as text. The table is created by {@link #createTables()}.
 */
public class JdbcApprovalQueue implements ApprovalQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcApprovalQueue.class);

    private static final String TABLE_NAME = "approvals";

    private static final String COLUMNS = """
            id, task_id, task_type, requested_action, reasoning, risk_level, estimated_impact,
            alternatives, decision, responded_by, feedback, modifications, requested_at,
            responded_at, expires_at, metadata""";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(64) PRIMARY KEY,
                task_id          VARCHAR(255) NOT NULL,
                task_type        VARCHAR(255) NOT NULL,
                requested_action TEXT NOT NULL,
                reasoning        TEXT NOT NULL,
                risk_level       VARCHAR(16) NOT NULL
                                 CHECK (risk_level IN ('low', 'medium', 'high', 'critical')),
                estimated_impact TEXT,
                alternatives     TEXT,
                decision         VARCHAR(16)
                                 CHECK (decision IS NULL OR decision IN ('approved', 'rejected', 'modified')),
                responded_by     VARCHAR(255),
                feedback         TEXT,
                modifications    TEXT,
                requested_at     TIMESTAMP WITH TIME ZONE NOT NULL,
                responded_at     TIMESTAMP WITH TIME ZONE,
                expires_at       TIMESTAMP WITH TIME ZONE,
                metadata         TEXT
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_PENDING_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_approvals_pending ON %s (decision, expires_at)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String DECIDE_SQL = """
            UPDATE %s
            SET decision = ?, responded_by = ?, feedback = ?, modifications = ?, responded_at = ?
            WHERE id = ? AND decision IS NULL
            """.formatted(TABLE_NAME);

    private static final String SELECT_EXPIRED_SQL = """
            SELECT %s FROM %s
            WHERE decision IS NULL AND expires_at < ?
            ORDER BY expires_at ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_PENDING_SQL = """
            SELECT %s FROM %s
            WHERE decision IS NULL
            ORDER BY requested_at ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_DECIDED_SQL = """
            SELECT %s FROM %s
            WHERE decision IS NOT NULL
            ORDER BY responded_at DESC
            LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String COUNT_BY_DECISION_SQL = """
            SELECT decision, COUNT(*) AS n FROM %s GROUP BY decision
            """.formatted(TABLE_NAME);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcApprovalQueue(DataSource dataSource) {
        this(dataSource, new ObjectMapper(), Clock.systemUTC());
    }

    public JdbcApprovalQueue(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the approvals table and its pending index if they do not exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_PENDING_INDEX_SQL);
            log.info("Approval table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public String create(ApprovalRecord record) {
        String id = record.id() != null ? record.id() : "apr_" + UUID.randomUUID();
        ApprovalRecord stored = record.withId(id, clock.instant());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, stored.id());
            stmt.setString(2, stored.taskId());
            stmt.setString(3, stored.taskType());
            stmt.setString(4, stored.requestedAction());
            stmt.setString(5, stored.reasoning());
            stmt.setString(6, stored.riskLevel().wireName());
            stmt.setString(7, toJson(stored.estimatedImpact()));
            stmt.setString(8, toJson(stored.alternatives()));
            stmt.setString(9, stored.decision() == null ? null : stored.decision().wireName());
            stmt.setString(10, stored.respondedBy());
            stmt.setString(11, stored.feedback());
            stmt.setString(12, toJson(stored.modifications()));
            stmt.setObject(13, toTimestamp(stored.requestedAt()));
            stmt.setObject(14, toTimestamp(stored.respondedAt()));
            stmt.setObject(15, toTimestamp(stored.expiresAt()));
            stmt.setString(16, toJson(stored.metadata()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new ApprovalException("Failed to store approval " + id + ": " + e.getMessage(), e);
        }
        log.info("Approval {} requested for task {} ({}, risk {})",
                id, stored.taskId(), stored.taskType(), stored.riskLevel());
        return id;
    }

    @Override
    public Optional<ApprovalRecord> get(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ApprovalException("Failed to load approval " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ApprovalRecord decide(String id, ApprovalDecision decision, String respondedBy,
                                 String feedback, Map<String, Object> modifications) {
        ApprovalQueue.validateDecision(decision, respondedBy);
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DECIDE_SQL)) {
            stmt.setString(1, decision.wireName());
            stmt.setString(2, respondedBy);
            stmt.setString(3, feedback);
            stmt.setString(4, toJson(modifications));
            stmt.setObject(5, toTimestamp(clock.instant()));
            stmt.setString(6, id);
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new ApprovalException("Failed to decide approval " + id + ": " + e.getMessage(), e);
        }
        ApprovalRecord current = get(id).orElseThrow(() -> new ApprovalNotFoundException(id));
        if (updated == 0) {
            throw new ApprovalConflictException(id, current.decision());
        }
        log.info("Approval {} {} by {}", id, decision.wireName(), respondedBy);
        return current;
    }

    @Override
    public List<ApprovalRecord> getExpired(Instant now) {
        return query(SELECT_EXPIRED_SQL, stmt -> stmt.setObject(1, toTimestamp(now)));
    }

    @Override
    public List<ApprovalRecord> listPending() {
        return query(SELECT_PENDING_SQL, stmt -> { });
    }

    @Override
    public List<ApprovalRecord> listDecided(int limit) {
        return query(SELECT_DECIDED_SQL, stmt -> stmt.setInt(1, limit));
    }

    @Override
    public ApprovalStats stats() {
        Map<ApprovalDecision, Long> counts = new HashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_BY_DECISION_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String decision = rs.getString("decision");
                counts.put(decision == null ? null : ApprovalDecision.fromWire(decision), rs.getLong("n"));
            }
        } catch (SQLException e) {
            throw new ApprovalException("Failed to count approvals: " + e.getMessage(), e);
        }
        return ApprovalStats.fromCounts(counts);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<ApprovalRecord> query(String sql, Binder binder) {
        List<ApprovalRecord> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new ApprovalException("Approval query failed: " + e.getMessage(), e);
        }
        return results;
    }

    private ApprovalRecord fromResultSet(ResultSet rs) throws SQLException {
        String decision = rs.getString("decision");
        return new ApprovalRecord(
                rs.getString("id"),
                rs.getString("task_id"),
                rs.getString("task_type"),
                rs.getString("requested_action"),
                rs.getString("reasoning"),
                RiskLevel.fromWire(rs.getString("risk_level")),
                fromJson(rs.getString("estimated_impact"), MAP_TYPE),
                fromJson(rs.getString("alternatives"), LIST_TYPE),
                decision == null ? null : ApprovalDecision.fromWire(decision),
                rs.getString("responded_by"),
                rs.getString("feedback"),
                fromJson(rs.getString("modifications"), MAP_TYPE),
                toInstant(rs.getObject("requested_at", OffsetDateTime.class)),
                toInstant(rs.getObject("responded_at", OffsetDateTime.class)),
                toInstant(rs.getObject("expires_at", OffsetDateTime.class)),
                fromJson(rs.getString("metadata"), MAP_TYPE));
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ApprovalException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ApprovalException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
