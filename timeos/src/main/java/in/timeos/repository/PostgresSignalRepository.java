package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.CategoryCounts;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalAggregator;
import in.timeos.domain.signal.SignalBalance;
import in.timeos.domain.signal.SignalCategory;
import in.timeos.domain.signal.SignalGroup;
import in.timeos.domain.signal.SignalSource;
import in.timeos.domain.signal.SignalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL implementation of SignalRepository.
 *
 * Status changes are guarded with {@code status = 'ACTIVE'} so a terminal signal is never
 * rewritten. Weighted aggregates are computed by {@link SignalAggregator} over the selected rows.
 */
public final class PostgresSignalRepository implements SignalRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSignalRepository.class);

    private static final String INSERT_SQL = """
            INSERT INTO signals (
                id, signal_type, signal_category, valence, magnitude,
                entity_type, entity_id,
                scope_task_id, scope_project_id, scope_retainer_id, scope_brand_id,
                scope_client_id, scope_person_id,
                source_type, source_id, source_url, source_excerpt, payload,
                detection_confidence, attribution_confidence,
                occurred_at, detected_at, expires_at,
                status, consumed_by_issue_id, balanced_by_signal_id, balanced_at,
                detector_id, detector_version, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb,
                      ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final DataSource dataSource;

    public PostgresSignalRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    // ========================================================================
    // WRITES
    // ========================================================================

    @Override
    public void insert(Signal signal) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {

            bindInsert(ps, signal);
            ps.executeUpdate();
            log.debug("Inserted signal {} ({}:{})", signal.id(), signal.signalType(), signal.entityId());
        } catch (Exception e) {
            log.error("Failed to insert signal {}: {}", signal.id(), e.getMessage());
            throw RepositoryErrors.wrap("Failed to insert signal", e);
        }
    }

    @Override
    public int insertAll(List<Signal> signals) {
        if (signals.isEmpty()) {
            return 0;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                for (Signal signal : signals) {
                    bindInsert(ps, signal);
                    ps.addBatch();
                }
                int[] counts = ps.executeBatch();
                conn.commit();

                int inserted = 0;
                for (int c : counts) {
                    // SUCCESS_NO_INFO (-2) still means the row went in
                    inserted += c == PreparedStatement.SUCCESS_NO_INFO ? 1 : c;
                }
                return inserted;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            log.error("Failed to insert {} signals: {}", signals.size(), e.getMessage());
            throw RepositoryErrors.wrap("Failed to insert signal batch", e);
        }
    }

    @Override
    public int markConsumed(Collection<String> signalIds, String issueId) {
        if (signalIds.isEmpty()) {
            return 0;
        }
        String sql = """
                UPDATE signals
                SET status = 'CONSUMED', consumed_by_issue_id = ?, updated_at = NOW()
                WHERE id = ANY(?) AND status = 'ACTIVE'
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, issueId);
            ps.setArray(2, conn.createArrayOf("text", signalIds.toArray()));
            return ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to mark signals consumed by {}: {}", issueId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to mark signals consumed", e);
        }
    }

    @Override
    public boolean markBalanced(String signalId, String bySignalId) {
        String sql = """
                UPDATE signals
                SET status = 'BALANCED', balanced_by_signal_id = ?, balanced_at = NOW(), updated_at = NOW()
                WHERE id = ? AND status IN ('ACTIVE', 'CONSUMED')
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, bySignalId);
            ps.setString(2, signalId);
            return ps.executeUpdate() > 0;
        } catch (Exception e) {
            log.error("Failed to mark signal {} balanced: {}", signalId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to mark signal balanced", e);
        }
    }

    @Override
    public int markExpired(Collection<String> signalIds) {
        if (signalIds.isEmpty()) {
            return 0;
        }
        String sql = """
                UPDATE signals
                SET status = 'EXPIRED', updated_at = NOW()
                WHERE id = ANY(?) AND status = 'ACTIVE'
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setArray(1, conn.createArrayOf("text", signalIds.toArray()));
            return ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to mark {} signals expired: {}", signalIds.size(), e.getMessage());
            throw RepositoryErrors.wrap("Failed to mark signals expired", e);
        }
    }

    @Override
    public int expireOldSignals() {
        String sql = """
                UPDATE signals
                SET status = 'EXPIRED', updated_at = NOW()
                WHERE status = 'ACTIVE'
                  AND expires_at IS NOT NULL
                  AND expires_at < NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to expire old signals: {}", e.getMessage());
            throw RepositoryErrors.wrap("Failed to expire old signals", e);
        }
    }

    // ========================================================================
    // READS
    // ========================================================================

    @Override
    public Optional<Signal> findById(String signalId) {
        String sql = "SELECT * FROM signals WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, signalId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find signal {}: {}", signalId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to find signal", e);
        }
        return Optional.empty();
    }

    @Override
    public List<Signal> findByIds(Collection<String> signalIds) {
        if (signalIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM signals WHERE id = ANY(?) ORDER BY detected_at DESC";

        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setArray(1, conn.createArrayOf("text", signalIds.toArray()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find {} signals by id: {}", signalIds.size(), e.getMessage());
            throw RepositoryErrors.wrap("Failed to find signals by id", e);
        }
        return signals;
    }

    @Override
    public List<Signal> findByEntity(String entityType, String entityId, SignalStatus status) {
        String sql = """
                SELECT * FROM signals
                WHERE entity_type = ? AND entity_id = ?
                  AND (?::text IS NULL OR status = ?)
                ORDER BY detected_at DESC
                """;

        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            String statusName = status != null ? status.name() : null;
            ps.setString(1, entityType);
            ps.setString(2, entityId);
            ps.setString(3, statusName);
            ps.setString(4, statusName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find signals for {} {}: {}", entityType, entityId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to find signals by entity", e);
        }
        return signals;
    }

    @Override
    public List<Signal> findByScope(ScopeLevel level, String scopeId, SignalStatus status, Integer valence) {
        String sql = """
                SELECT * FROM signals
                WHERE %s = ?
                  AND (?::text IS NULL OR status = ?)
                  AND (?::smallint IS NULL OR valence = ?)
                ORDER BY detected_at DESC
                """.formatted(level.column());

        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            String statusName = status != null ? status.name() : null;
            ps.setString(1, scopeId);
            ps.setString(2, statusName);
            ps.setString(3, statusName);
            setIntOrNull(ps, 4, valence);
            setIntOrNull(ps, 5, valence);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find signals for {} {}: {}", level, scopeId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to find signals by scope", e);
        }
        return signals;
    }

    @Override
    public List<Signal> findActive(Collection<String> types, String clientId, int windowDays, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT * FROM signals
                WHERE status = 'ACTIVE'
                  AND detected_at > ?
                """);
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(Instant.now().minus(Duration.ofDays(windowDays))));

        if (types != null && !types.isEmpty()) {
            sql.append("  AND signal_type = ANY(?)\n");
            params.add(types);
        }
        if (clientId != null) {
            sql.append("  AND scope_client_id = ?\n");
            params.add(clientId);
        }
        sql.append("ORDER BY detected_at DESC LIMIT ?");
        params.add(limit);

        return select(sql.toString(), params, "Failed to find active signals");
    }

    @Override
    public List<Signal> query(SignalQuery q) {
        StringBuilder sql = new StringBuilder("SELECT * FROM signals WHERE 1=1\n");
        List<Object> params = new ArrayList<>();

        if (q.status() != null) {
            sql.append("  AND status = ?\n");
            params.add(q.status().name());
        }
        if (q.valence() != null) {
            sql.append("  AND valence = ?\n");
            params.add(q.valence());
        }
        if (q.category() != null) {
            sql.append("  AND signal_category = ?\n");
            params.add(q.category().name());
        }
        if (q.signalType() != null) {
            sql.append("  AND signal_type = ?\n");
            params.add(q.signalType());
        }
        if (q.scopeLevel() != null) {
            sql.append("  AND ").append(q.scopeLevel().column()).append(" = ?\n");
            params.add(q.scopeId());
        }
        if (q.entityType() != null) {
            sql.append("  AND entity_type = ?\n");
            params.add(q.entityType());
        }
        if (q.entityId() != null) {
            sql.append("  AND entity_id = ?\n");
            params.add(q.entityId());
        }
        if (q.windowDays() != null) {
            sql.append("  AND detected_at > ?\n");
            params.add(Timestamp.from(Instant.now().minus(Duration.ofDays(q.windowDays()))));
        }
        sql.append("ORDER BY detected_at DESC LIMIT ? OFFSET ?");
        params.add(q.limit());
        params.add(q.offset());

        return select(sql.toString(), params, "Failed to query signals");
    }

    @Override
    public List<SignalGroup> findForIssueFormation(Collection<String> types, ScopeLevel level,
                                                   int minCount, double minNegativeMagnitude) {
        String sql = """
                SELECT * FROM signals
                WHERE status = 'ACTIVE'
                  AND signal_type = ANY(?)
                  AND %s IS NOT NULL
                ORDER BY %s, detected_at
                """.formatted(level.column(), level.column());

        List<Signal> candidates = select(sql, List.of(types), "Failed to load signals for issue formation");
        List<SignalGroup> groups = SignalAggregator.groupByScope(candidates, level, Instant.now());
        return SignalAggregator.qualifying(groups, minCount, minNegativeMagnitude);
    }

    @Override
    public List<Signal> findNegativeSince(ScopeLevel level, String scopeId, Instant since) {
        String sql = """
                SELECT * FROM signals
                WHERE %s = ?
                  AND valence = -1
                  AND status = 'ACTIVE'
                  AND detected_at > ?
                ORDER BY detected_at
                """.formatted(level.column());

        return select(sql, List.of(scopeId, Timestamp.from(since)), "Failed to find regression signals");
    }

    @Override
    public Set<String> findActiveKeys(Collection<String> types) {
        if (types.isEmpty()) {
            return Set.of();
        }
        String sql = """
                SELECT signal_type, entity_id FROM signals
                WHERE status = 'ACTIVE' AND signal_type = ANY(?)
                """;

        Set<String> keys = new HashSet<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setArray(1, conn.createArrayOf("text", types.toArray()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(Signal.dedupKey(rs.getString("signal_type"), rs.getString("entity_id")));
                }
            }
        } catch (Exception e) {
            log.error("Failed to load active signal keys: {}", e.getMessage());
            throw RepositoryErrors.wrap("Failed to load active signal keys", e);
        }
        return keys;
    }

    @Override
    public List<Signal> findActiveByValence(Collection<String> types, int valence, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT * FROM signals
                WHERE status = 'ACTIVE' AND valence = ?
                """);
        List<Object> params = new ArrayList<>();
        params.add(valence);
        if (types != null && !types.isEmpty()) {
            sql.append("  AND signal_type = ANY(?)\n");
            params.add(types);
        }
        sql.append("ORDER BY detected_at DESC LIMIT ?");
        params.add(limit);

        return select(sql.toString(), params, "Failed to find active signals by valence");
    }

    @Override
    public SignalBalance balanceForScope(ScopeLevel level, String scopeId) {
        List<Signal> active = findByScope(level, scopeId, SignalStatus.ACTIVE, null);
        return SignalAggregator.balanceOf(active, Instant.now());
    }

    @Override
    public Map<SignalCategory, CategoryCounts> countByCategory(ScopeLevel level, String scopeId, int windowDays) {
        StringBuilder sql = new StringBuilder("""
                SELECT signal_category, valence, COUNT(*) AS cnt
                FROM signals
                WHERE status = 'ACTIVE'
                  AND detected_at > ?
                """);
        if (level != null && scopeId != null) {
            sql.append("  AND ").append(level.column()).append(" = ?\n");
        }
        sql.append("GROUP BY signal_category, valence");

        Map<SignalCategory, CategoryCounts> counts = new EnumMap<>(SignalCategory.class);
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            ps.setTimestamp(1, Timestamp.from(Instant.now().minus(Duration.ofDays(windowDays))));
            if (level != null && scopeId != null) {
                ps.setString(2, scopeId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    SignalCategory category = SignalCategory.valueOf(rs.getString("signal_category"));
                    counts.merge(category,
                        CategoryCounts.ZERO.plus(rs.getInt("valence"), rs.getLong("cnt")),
                        (a, b) -> new CategoryCounts(a.negative() + b.negative(),
                            a.neutral() + b.neutral(), a.positive() + b.positive()));
                }
            }
        } catch (Exception e) {
            log.error("Failed to count signals by category: {}", e.getMessage());
            throw RepositoryErrors.wrap("Failed to count signals by category", e);
        }
        return counts;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private List<Signal> select(String sql, List<?> params, String failure) {
        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            for (Object param : params) {
                if (param instanceof Collection<?> values) {
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
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("{}: {}", failure, e.getMessage());
            throw RepositoryErrors.wrap(failure, e);
        }
        return signals;
    }

    private void bindInsert(PreparedStatement ps, Signal s) throws Exception {
        ScopeChain scope = s.scope();
        ps.setString(1, s.id());
        ps.setString(2, s.signalType());
        ps.setString(3, s.category().name());
        ps.setInt(4, s.valence());
        ps.setDouble(5, s.magnitude());
        ps.setString(6, s.entityType());
        ps.setString(7, s.entityId());
        ps.setString(8, scope.taskId());
        ps.setString(9, scope.projectId());
        ps.setString(10, scope.retainerId());
        ps.setString(11, scope.brandId());
        ps.setString(12, scope.clientId());
        ps.setString(13, scope.personId());
        ps.setString(14, s.sourceType().name());
        ps.setString(15, s.sourceId());
        ps.setString(16, s.sourceUrl());
        ps.setString(17, s.sourceExcerpt());
        ps.setString(18, JsonColumns.write(s.payload()));
        ps.setDouble(19, s.detectionConfidence());
        ps.setDouble(20, s.attributionConfidence());
        setTimestampOrNull(ps, 21, s.occurredAt());
        setTimestampOrNull(ps, 22, s.detectedAt());
        setTimestampOrNull(ps, 23, s.expiresAt());
        ps.setString(24, s.status().name());
        ps.setString(25, s.consumedByIssueId());
        ps.setString(26, s.balancedBySignalId());
        setTimestampOrNull(ps, 27, s.balancedAt());
        ps.setString(28, s.detectorId());
        ps.setString(29, s.detectorVersion());
        Instant created = s.createdAt() != null ? s.createdAt() : Instant.now();
        setTimestampOrNull(ps, 30, created);
        setTimestampOrNull(ps, 31, s.updatedAt() != null ? s.updatedAt() : created);
    }

    private Signal mapRow(ResultSet rs) throws Exception {
        ScopeChain scope = new ScopeChain(
            rs.getString("scope_task_id"),
            rs.getString("scope_project_id"),
            rs.getString("scope_retainer_id"),
            rs.getString("scope_brand_id"),
            rs.getString("scope_client_id"),
            rs.getString("scope_person_id")
        );

        return new Signal(
            rs.getString("id"),
            rs.getString("signal_type"),
            SignalCategory.valueOf(rs.getString("signal_category")),
            rs.getInt("valence"),
            rs.getDouble("magnitude"),
            rs.getString("entity_type"),
            rs.getString("entity_id"),
            scope,
            SignalSource.valueOf(rs.getString("source_type")),
            rs.getString("source_id"),
            rs.getString("source_url"),
            rs.getString("source_excerpt"),
            JsonColumns.readMap(rs.getString("payload")),
            rs.getDouble("detection_confidence"),
            rs.getDouble("attribution_confidence"),
            toInstant(rs.getTimestamp("occurred_at")),
            toInstant(rs.getTimestamp("detected_at")),
            toInstant(rs.getTimestamp("expires_at")),
            SignalStatus.valueOf(rs.getString("status")),
            rs.getString("consumed_by_issue_id"),
            rs.getString("balanced_by_signal_id"),
            toInstant(rs.getTimestamp("balanced_at")),
            rs.getString("detector_id"),
            rs.getString("detector_version"),
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

    private void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.SMALLINT);
        }
    }
}
