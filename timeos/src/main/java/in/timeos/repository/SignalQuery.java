package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.SignalCategory;
import in.timeos.domain.signal.SignalStatus;

/**
 * Filters for listing signals. Null fields are not applied.
 */
public record SignalQuery(
    SignalStatus status,
    Integer valence,
    SignalCategory category,
    String signalType,
    ScopeLevel scopeLevel,
    String scopeId,
    String entityType,
    String entityId,
    Integer windowDays,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public SignalQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        offset = Math.max(offset, 0);
        if ((scopeLevel == null) != (scopeId == null)) {
            throw new IllegalArgumentException("Scope filter needs both level and id");
        }
    }

    public static SignalQuery all() {
        return new SignalQuery(null, null, null, null, null, null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static SignalQuery active() {
        return new SignalQuery(SignalStatus.ACTIVE, null, null, null, null, null, null, null, null, DEFAULT_LIMIT, 0);
    }
}
