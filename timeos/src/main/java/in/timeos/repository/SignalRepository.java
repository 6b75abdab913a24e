package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.CategoryCounts;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalBalance;
import in.timeos.domain.signal.SignalCategory;
import in.timeos.domain.signal.SignalGroup;
import in.timeos.domain.signal.SignalStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Signal store. Append-mostly: after insert only status and consumption fields change.
 */
public interface SignalRepository {
    /**
     * Insert one signal.
     */
    void insert(Signal signal);

    /**
     * Insert a detector batch in a single transaction.
     *
     * @return number of rows inserted
     */
    int insertAll(List<Signal> signals);

    /**
     * Find signal by ID.
     */
    Optional<Signal> findById(String signalId);

    /**
     * Find signals by ID, any status. Unknown ids are ignored.
     */
    List<Signal> findByIds(Collection<String> signalIds);

    /**
     * Signals observed on one entity, newest first.
     *
     * @param status optional status filter
     */
    List<Signal> findByEntity(String entityType, String entityId, SignalStatus status);

    /**
     * Signals whose scope chain has {@code scopeId} at {@code level}, newest first.
     *
     * @param status optional status filter
     * @param valence optional valence filter
     */
    List<Signal> findByScope(ScopeLevel level, String scopeId, SignalStatus status, Integer valence);

    /**
     * Active signals detected in the last {@code windowDays}.
     *
     * @param types optional type filter
     * @param clientId optional client scope filter
     */
    List<Signal> findActive(Collection<String> types, String clientId, int windowDays, int limit);

    /**
     * Facade listing with filters and paging.
     */
    List<Signal> query(SignalQuery query);

    /**
     * Active signals of the given types grouped by {@code scope_<level>_id}, with
     * recency-weighted aggregates. Only groups with at least {@code minCount} signals and
     * {@code minNegativeMagnitude} weighted negative magnitude are returned.
     */
    List<SignalGroup> findForIssueFormation(Collection<String> types, ScopeLevel level,
                                            int minCount, double minNegativeMagnitude);

    /**
     * Active negative signals in one scope detected strictly after {@code since}.
     * Used by the regression check.
     */
    List<Signal> findNegativeSince(ScopeLevel level, String scopeId, Instant since);

    /**
     * Dedup keys ({@code type:entityId}) of every active signal of the given types.
     */
    Set<String> findActiveKeys(Collection<String> types);

    /**
     * Active signals of the given types and valence, newest first.
     */
    List<Signal> findActiveByValence(Collection<String> types, int valence, int limit);

    /**
     * Mark active signals consumed by an issue. Non-active rows are left alone.
     *
     * @return rows changed
     */
    int markConsumed(Collection<String> signalIds, String issueId);

    /**
     * Mark an active or consumed signal balanced by another.
     *
     * @return true if the row changed
     */
    boolean markBalanced(String signalId, String bySignalId);

    /**
     * Mark active signals expired.
     *
     * @return rows changed
     */
    int markExpired(Collection<String> signalIds);

    /**
     * Expire every active signal whose expires_at has passed.
     *
     * @return rows changed
     */
    int expireOldSignals();

    /**
     * Weighted balance of the active signals in a scope.
     */
    SignalBalance balanceForScope(ScopeLevel level, String scopeId);

    /**
     * Active signal counts per category and valence over the last {@code windowDays}.
     *
     * @param level optional scope level; applied with {@code scopeId}
     */
    Map<SignalCategory, CategoryCounts> countByCategory(ScopeLevel level, String scopeId, int windowDays);
}
