package in.timeos.service.issue;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.IssueSeverity;

/**
 * Issue priority: severity base x scope multiplier x (1 + 0.1 x negative magnitude).
 */
public final class PriorityCalculator {

    public static double priority(IssueSeverity severity, ScopeLevel scope, double negativeMagnitude) {
        return severity.baseScore() * scopeMultiplier(scope) * (1 + negativeMagnitude * 0.1);
    }

    /**
     * PERSON never scopes an issue; it maps to 1.0.
     */
    public static double scopeMultiplier(ScopeLevel scope) {
        return switch (scope) {
            case TASK -> 0.5;
            case PROJECT -> 1.0;
            case RETAINER -> 1.2;
            case BRAND -> 1.5;
            case CLIENT -> 2.0;
            case PERSON -> 1.0;
        };
    }

    private PriorityCalculator() {}
}
