package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.IssueState;

/**
 * Filters for listing issues. Null fields are not applied.
 */
public record IssueQuery(
    IssueState state,
    ScopeLevel scopeType,
    String scopeId,
    String issueSubtype,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public IssueQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, SignalQuery.MAX_LIMIT);
        offset = Math.max(offset, 0);
        if (scopeType == ScopeLevel.PERSON) {
            throw new IllegalArgumentException("Issues are never scoped to a person");
        }
    }

    public static IssueQuery all() {
        return new IssueQuery(null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static IssueQuery inState(IssueState state) {
        return new IssueQuery(state, null, null, null, DEFAULT_LIMIT, 0);
    }
}
