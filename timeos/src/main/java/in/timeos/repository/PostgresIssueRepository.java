package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.IssueType;
import in.timeos.domain.issue.RecommendedUrgency;
import in.timeos.domain.issue.ResolutionMethod;
import in.timeos.domain.issue.Trajectory;
import in.timeos.domain.signal.SignalBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of IssueRepository.
 *
 * signal_ids and state_history are JSONB arrays; everything else is a plain column.
 */
public final class PostgresIssueRepository implements IssueRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresIssueRepository.class);

    private static final String OPEN_STATES = "('DETECTED', 'SURFACED', 'ACKNOWLEDGED', 'ADDRESSING')";

    private final DataSource dataSource;

    public PostgresIssueRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(Issue issue) {
        String sql = """
                INSERT INTO issues (
                    issue_type, issue_subtype, scope_type, scope_id,
                    scope_task_id, scope_project_id, scope_retainer_id, scope_brand_id, scope_client_id,
                    headline, description, severity, priority_score, trajectory, signal_ids,
                    balance_negative_count, balance_neutral_count, balance_positive_count,
                    balance_negative_magnitude, balance_positive_magnitude, balance_net_score,
                    recommended_action, recommended_owner_role, recommended_urgency,
                    state, regression_count, state_history,
                    detected_at, surfaced_at, acknowledged_at, acknowledged_by, addressing_started_at,
                    resolved_at, resolution_method, resolved_by, resolution_notes,
                    monitoring_until, closed_at, last_regression_at,
                    created_at, updated_at, id
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb,
                          ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb,
                          ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            int idx = bindColumns(ps, issue);
            setTimestampOrNull(ps, idx++, issue.createdAt() != null ? issue.createdAt() : now);
            setTimestampOrNull(ps, idx++, issue.updatedAt() != null ? issue.updatedAt() : now);
            ps.setString(idx, issue.id());
            ps.executeUpdate();

            log.info("[FORMATION] Inserted issue {} ({} / {})", issue.id(), issue.issueSubtype(), issue.scopeId());
        } catch (Exception e) {
            log.error("Failed to insert issue {}: {}", issue.id(), e.getMessage());
            throw RepositoryErrors.wrap("Failed to insert issue", e);
        }
    }

    @Override
    public boolean update(Issue issue) {
        String sql = """
                UPDATE issues SET
                    issue_type = ?, issue_subtype = ?, scope_type = ?, scope_id = ?,
                    scope_task_id = ?, scope_project_id = ?, scope_retainer_id = ?, scope_brand_id = ?,
                    scope_client_id = ?,
                    headline = ?, description = ?, severity = ?, priority_score = ?, trajectory = ?,
                    signal_ids = ?::jsonb,
                    balance_negative_count = ?, balance_neutral_count = ?, balance_positive_count = ?,
                    balance_negative_magnitude = ?, balance_positive_magnitude = ?, balance_net_score = ?,
                    recommended_action = ?, recommended_owner_role = ?, recommended_urgency = ?,
                    state = ?, regression_count = ?, state_history = ?::jsonb,
                    detected_at = ?, surfaced_at = ?, acknowledged_at = ?, acknowledged_by = ?,
                    addressing_started_at = ?,
                    resolved_at = ?, resolution_method = ?, resolved_by = ?, resolution_notes = ?,
                    monitoring_until = ?, closed_at = ?, last_regression_at = ?,
                    updated_at = ?
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = bindColumns(ps, issue);
            setTimestampOrNull(ps, idx++, issue.updatedAt() != null ? issue.updatedAt() : Instant.now());
            ps.setString(idx, issue.id());
            return ps.executeUpdate() > 0;
        } catch (Exception e) {
            log.error("Failed to update issue {}: {}", issue.id(), e.getMessage());
            throw RepositoryErrors.wrap("Failed to update issue", e);
        }
    }

    @Override
    public Optional<Issue> findById(String issueId) {
        List<Issue> found = select("SELECT * FROM issues WHERE id = ?", List.of(issueId),
            "Failed to find issue " + issueId);
        return found.stream().findFirst();
    }

    @Override
    public Optional<Issue> findOpen(String issueSubtype, String scopeId) {
        String sql = """
                SELECT * FROM issues
                WHERE issue_subtype = ? AND scope_id = ?
                  AND state IN %s
                ORDER BY created_at DESC
                LIMIT 1
                """.formatted(OPEN_STATES);

        List<Issue> found = select(sql, List.of(issueSubtype, scopeId), "Failed to find open issue");
        return found.stream().findFirst();
    }

    @Override
    public List<Issue> findOpenBySubtype(String issueSubtype) {
        String sql = """
                SELECT * FROM issues
                WHERE issue_subtype = ? AND state IN %s
                ORDER BY created_at
                """.formatted(OPEN_STATES);

        return select(sql, List.of(issueSubtype), "Failed to find open issues for " + issueSubtype);
    }

    @Override
    public List<Issue> findByState(IssueState state) {
        String sql = """
                SELECT * FROM issues
                WHERE state = ?
                ORDER BY created_at
                """;

        return select(sql, List.of(state.name()), "Failed to find issues in state " + state);
    }

    @Override
    public List<Issue> findMonitoringActive(Instant now) {
        String sql = """
                SELECT * FROM issues
                WHERE state = 'MONITORING'
                  AND monitoring_until > ?
                ORDER BY monitoring_until
                """;

        return select(sql, List.of(Timestamp.from(now)), "Failed to find monitoring issues");
    }

    @Override
    public List<Issue> findMonitoringExpired(Instant now) {
        String sql = """
                SELECT * FROM issues
                WHERE state = 'MONITORING'
                  AND monitoring_until <= ?
                ORDER BY monitoring_until
                """;

        return select(sql, List.of(Timestamp.from(now)), "Failed to find expired monitoring issues");
    }

    @Override
    public List<Issue> findBySignalIds(List<String> signalIds) {
        if (signalIds.isEmpty()) {
            return List.of();
        }
        String sql = """
                SELECT * FROM issues
                WHERE EXISTS (
                    SELECT 1 FROM jsonb_array_elements_text(signal_ids) AS sid
                    WHERE sid = ANY(?)
                )
                """;

        return select(sql, List.of(signalIds), "Failed to find issues by signal ids");
    }

    @Override
    public List<Issue> query(IssueQuery q) {
        StringBuilder sql = new StringBuilder("SELECT * FROM issues WHERE 1=1\n");
        List<Object> params = new ArrayList<>();

        if (q.state() != null) {
            sql.append("  AND state = ?\n");
            params.add(q.state().name());
        }
        if (q.issueSubtype() != null) {
            sql.append("  AND issue_subtype = ?\n");
            params.add(q.issueSubtype());
        }
        if (q.scopeType() != null && q.scopeId() != null) {
            sql.append("  AND ").append(q.scopeType().column()).append(" = ?\n");
            params.add(q.scopeId());
        } else if (q.scopeId() != null) {
            sql.append("  AND scope_id = ?\n");
            params.add(q.scopeId());
        } else if (q.scopeType() != null) {
            sql.append("  AND scope_type = ?\n");
            params.add(q.scopeType().name());
        }
        sql.append("ORDER BY priority_score DESC, created_at DESC LIMIT ? OFFSET ?");
        params.add(q.limit());
        params.add(q.offset());

        return select(sql.toString(), params, "Failed to query issues");
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private List<Issue> select(String sql, List<?> params, String failure) {
        List<Issue> issues = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            for (Object param : params) {
                if (param instanceof List<?> values) {
                    ps.setArray(idx++, conn.createArrayOf("text", values.toArray()));
                } else if (param instanceof Timestamp ts) {
                    ps.setTimestamp(idx++, ts);
                } else if (param instanceof Integer i) {
                    ps.setInt(idx++, i);
                } else {
                    ps.setString(idx++, (String) param);
                }
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    issues.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("{}: {}", failure, e.getMessage());
            throw RepositoryErrors.wrap(failure, e);
        }
        return issues;
    }

    /**
     * Bind the shared column list of insert and update. Returns the next parameter index.
     */
    private int bindColumns(PreparedStatement ps, Issue issue) throws Exception {
        SignalBalance b = issue.balance();
        int i = 1;
        ps.setString(i++, issue.issueType().name());
        ps.setString(i++, issue.issueSubtype());
        ps.setString(i++, issue.scopeType().name());
        ps.setString(i++, issue.scopeId());
        ps.setString(i++, issue.scopeType() == ScopeLevel.TASK ? issue.scopeId() : null);
        ps.setString(i++, issue.scopeProjectId());
        ps.setString(i++, issue.scopeRetainerId());
        ps.setString(i++, issue.scopeBrandId());
        ps.setString(i++, issue.scopeClientId());
        ps.setString(i++, issue.headline());
        ps.setString(i++, issue.description());
        ps.setString(i++, issue.severity().name());
        ps.setDouble(i++, issue.priorityScore());
        ps.setString(i++, issue.trajectory().name());
        ps.setString(i++, JsonColumns.write(issue.signalIds()));
        ps.setInt(i++, b.negativeCount());
        ps.setInt(i++, b.neutralCount());
        ps.setInt(i++, b.positiveCount());
        ps.setDouble(i++, b.negativeMagnitude());
        ps.setDouble(i++, b.positiveMagnitude());
        ps.setDouble(i++, b.netScore());
        ps.setString(i++, issue.recommendedAction());
        ps.setString(i++, issue.recommendedOwnerRole());
        ps.setString(i++, issue.recommendedUrgency() != null ? issue.recommendedUrgency().name() : null);
        ps.setString(i++, issue.state().name());
        ps.setInt(i++, issue.regressionCount());
        ps.setString(i++, JsonColumns.write(issue.stateHistory()));
        setTimestampOrNull(ps, i++, issue.detectedAt());
        setTimestampOrNull(ps, i++, issue.surfacedAt());
        setTimestampOrNull(ps, i++, issue.acknowledgedAt());
        ps.setString(i++, issue.acknowledgedBy());
        setTimestampOrNull(ps, i++, issue.addressingStartedAt());
        setTimestampOrNull(ps, i++, issue.resolvedAt());
        ps.setString(i++, issue.resolutionMethod() != null ? issue.resolutionMethod().name() : null);
        ps.setString(i++, issue.resolvedBy());
        ps.setString(i++, issue.resolutionNotes());
        setTimestampOrNull(ps, i++, issue.monitoringUntil());
        setTimestampOrNull(ps, i++, issue.closedAt());
        setTimestampOrNull(ps, i++, issue.lastRegressionAt());
        return i;
    }

    private Issue mapRow(ResultSet rs) throws Exception {
        String urgency = rs.getString("recommended_urgency");
        String method = rs.getString("resolution_method");

        SignalBalance balance = new SignalBalance(
            rs.getInt("balance_negative_count"),
            rs.getInt("balance_neutral_count"),
            rs.getInt("balance_positive_count"),
            rs.getDouble("balance_negative_magnitude"),
            rs.getDouble("balance_positive_magnitude")
        );

        return new Issue(
            rs.getString("id"),
            IssueType.valueOf(rs.getString("issue_type")),
            rs.getString("issue_subtype"),
            ScopeLevel.valueOf(rs.getString("scope_type")),
            rs.getString("scope_id"),
            rs.getString("scope_project_id"),
            rs.getString("scope_retainer_id"),
            rs.getString("scope_brand_id"),
            rs.getString("scope_client_id"),
            rs.getString("headline"),
            rs.getString("description"),
            IssueSeverity.valueOf(rs.getString("severity")),
            rs.getDouble("priority_score"),
            Trajectory.valueOf(rs.getString("trajectory")),
            JsonColumns.readStringList(rs.getString("signal_ids")),
            balance,
            rs.getString("recommended_action"),
            rs.getString("recommended_owner_role"),
            urgency != null ? RecommendedUrgency.valueOf(urgency) : null,
            IssueState.valueOf(rs.getString("state")),
            rs.getInt("regression_count"),
            JsonColumns.readHistory(rs.getString("state_history")),
            toInstant(rs.getTimestamp("detected_at")),
            toInstant(rs.getTimestamp("surfaced_at")),
            toInstant(rs.getTimestamp("acknowledged_at")),
            rs.getString("acknowledged_by"),
            toInstant(rs.getTimestamp("addressing_started_at")),
            toInstant(rs.getTimestamp("resolved_at")),
            method != null ? ResolutionMethod.valueOf(method) : null,
            rs.getString("resolved_by"),
            rs.getString("resolution_notes"),
            toInstant(rs.getTimestamp("monitoring_until")),
            toInstant(rs.getTimestamp("closed_at")),
            toInstant(rs.getTimestamp("last_regression_at")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private void setTimestampOrNull(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value != null) {
            ps.setTimestamp(index, Timestamp.from(value));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
