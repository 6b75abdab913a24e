package in.timeos.support;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.CategoryCounts;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalAggregator;
import in.timeos.domain.signal.SignalBalance;
import in.timeos.domain.signal.SignalCategory;
import in.timeos.domain.signal.SignalGroup;
import in.timeos.domain.signal.SignalStatus;
import in.timeos.repository.SignalQuery;
import in.timeos.repository.SignalRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Map-backed signal store with the same filters as the Postgres queries. Time comes from the clock.
 */
public class InMemorySignalRepository implements SignalRepository {
    private final Map<String, Signal> signals = new LinkedHashMap<>();
    private final Clock clock;

    public InMemorySignalRepository(Clock clock) {
        this.clock = clock;
    }

    public synchronized List<Signal> all() {
        return new ArrayList<>(signals.values());
    }

    public synchronized Signal require(String signalId) {
        Signal s = signals.get(signalId);
        if (s == null) {
            throw new AssertionError("No signal " + signalId);
        }
        return s;
    }

    @Override
    public synchronized void insert(Signal signal) {
        if (signals.containsKey(signal.id())) {
            throw new IllegalStateException("Duplicate signal id " + signal.id());
        }
        signals.put(signal.id(), signal);
    }

    @Override
    public synchronized int insertAll(List<Signal> batch) {
        batch.forEach(this::insert);
        return batch.size();
    }

    @Override
    public synchronized Optional<Signal> findById(String signalId) {
        return Optional.ofNullable(signals.get(signalId));
    }

    @Override
    public synchronized List<Signal> findByIds(Collection<String> signalIds) {
        return signalIds.stream().map(signals::get).filter(s -> s != null).toList();
    }

    @Override
    public synchronized List<Signal> findByEntity(String entityType, String entityId, SignalStatus status) {
        return newestFirst(s -> s.entityType().equals(entityType) && s.entityId().equals(entityId)
            && (status == null || s.status() == status));
    }

    @Override
    public synchronized List<Signal> findByScope(ScopeLevel level, String scopeId, SignalStatus status, Integer valence) {
        return newestFirst(s -> scopeId.equals(s.scope().idFor(level))
            && (status == null || s.status() == status)
            && (valence == null || s.valence() == valence));
    }

    @Override
    public synchronized List<Signal> findActive(Collection<String> types, String clientId, int windowDays, int limit) {
        Instant since = clock.instant().minus(Duration.ofDays(windowDays));
        return newestFirst(s -> s.status() == SignalStatus.ACTIVE
            && s.detectedAt().isAfter(since)
            && (types == null || types.isEmpty() || types.contains(s.signalType()))
            && (clientId == null || clientId.equals(s.scope().clientId())))
            .stream().limit(limit).toList();
    }

    @Override
    public synchronized List<Signal> query(SignalQuery q) {
        Instant since = q.windowDays() == null ? null : clock.instant().minus(Duration.ofDays(q.windowDays()));
        return newestFirst(s -> (q.status() == null || s.status() == q.status())
            && (q.valence() == null || s.valence() == q.valence())
            && (q.category() == null || s.category() == q.category())
            && (q.signalType() == null || s.signalType().equals(q.signalType()))
            && (q.scopeLevel() == null || q.scopeId().equals(s.scope().idFor(q.scopeLevel())))
            && (q.entityType() == null || s.entityType().equals(q.entityType()))
            && (q.entityId() == null || s.entityId().equals(q.entityId()))
            && (since == null || s.detectedAt().isAfter(since)))
            .stream().skip(q.offset()).limit(q.limit()).toList();
    }

    @Override
    public synchronized List<SignalGroup> findForIssueFormation(Collection<String> types, ScopeLevel level,
                                                                int minCount, double minNegativeMagnitude) {
        List<Signal> candidates = activeStream()
            .filter(s -> types.contains(s.signalType()) && s.scope().idFor(level) != null)
            .sorted(Comparator.comparing(Signal::detectedAt))
            .toList();
        List<SignalGroup> groups = SignalAggregator.groupByScope(candidates, level, clock.instant());
        return SignalAggregator.qualifying(groups, minCount, minNegativeMagnitude);
    }

    @Override
    public synchronized List<Signal> findNegativeSince(ScopeLevel level, String scopeId, Instant since) {
        return activeStream()
            .filter(s -> s.valence() == -1 && scopeId.equals(s.scope().idFor(level)) && s.detectedAt().isAfter(since))
            .sorted(Comparator.comparing(Signal::detectedAt))
            .toList();
    }

    @Override
    public synchronized Set<String> findActiveKeys(Collection<String> types) {
        Set<String> keys = new HashSet<>();
        activeStream().filter(s -> types.contains(s.signalType())).forEach(s -> keys.add(s.dedupKey()));
        return keys;
    }

    @Override
    public synchronized List<Signal> findActiveByValence(Collection<String> types, int valence, int limit) {
        return newestFirst(s -> s.status() == SignalStatus.ACTIVE && s.valence() == valence
            && (types == null || types.isEmpty() || types.contains(s.signalType())))
            .stream().limit(limit).toList();
    }

    @Override
    public synchronized int markConsumed(Collection<String> signalIds, String issueId) {
        int updated = 0;
        for (String id : signalIds) {
            Signal s = signals.get(id);
            if (s != null && s.status() == SignalStatus.ACTIVE) {
                signals.put(id, s.toBuilder().status(SignalStatus.CONSUMED).consumedByIssueId(issueId)
                    .updatedAt(clock.instant()).build());
                updated++;
            }
        }
        return updated;
    }

    @Override
    public synchronized boolean markBalanced(String signalId, String bySignalId) {
        Signal s = signals.get(signalId);
        if (s == null || !s.status().isLive()) {
            return false;
        }
        signals.put(signalId, s.toBuilder().status(SignalStatus.BALANCED).balancedBy(bySignalId, clock.instant())
            .updatedAt(clock.instant()).build());
        return true;
    }

    @Override
    public synchronized int markExpired(Collection<String> signalIds) {
        int updated = 0;
        for (String id : signalIds) {
            Signal s = signals.get(id);
            if (s != null && s.status() == SignalStatus.ACTIVE) {
                signals.put(id, s.toBuilder().status(SignalStatus.EXPIRED).updatedAt(clock.instant()).build());
                updated++;
            }
        }
        return updated;
    }

    @Override
    public synchronized int expireOldSignals() {
        Instant now = clock.instant();
        List<String> due = activeStream()
            .filter(s -> s.expiresAt() != null && s.expiresAt().isBefore(now))
            .map(Signal::id)
            .toList();
        return markExpired(due);
    }

    @Override
    public synchronized SignalBalance balanceForScope(ScopeLevel level, String scopeId) {
        return SignalAggregator.balanceOf(findByScope(level, scopeId, SignalStatus.ACTIVE, null), clock.instant());
    }

    @Override
    public synchronized Map<SignalCategory, CategoryCounts> countByCategory(ScopeLevel level, String scopeId,
                                                                           int windowDays) {
        Instant since = clock.instant().minus(Duration.ofDays(windowDays));
        Map<SignalCategory, CategoryCounts> counts = new EnumMap<>(SignalCategory.class);
        activeStream()
            .filter(s -> s.detectedAt().isAfter(since))
            .filter(s -> level == null || scopeId == null || scopeId.equals(s.scope().idFor(level)))
            .forEach(s -> counts.merge(s.category(), CategoryCounts.ZERO.plus(s.valence(), 1),
                (a, b) -> new CategoryCounts(a.negative() + b.negative(),
                    a.neutral() + b.neutral(), a.positive() + b.positive())));
        return counts;
    }

    private Stream<Signal> activeStream() {
        return signals.values().stream().filter(s -> s.status() == SignalStatus.ACTIVE);
    }

    private List<Signal> newestFirst(Predicate<Signal> filter) {
        return signals.values().stream()
            .filter(filter)
            .sorted(Comparator.comparing(Signal::detectedAt).reversed())
            .toList();
    }
}
