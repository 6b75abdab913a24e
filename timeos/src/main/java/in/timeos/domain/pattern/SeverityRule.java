package in.timeos.domain.pattern;

import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.signal.SignalGroup;

/**
 * Threshold predicates that assign a severity. Null thresholds are not checked, so a rule with no
 * thresholds matches every group.
 */
public record SeverityRule(
    IssueSeverity severity,
    Double minMagnitude,
    Integer minSignalCount,
    Integer minCategoryCount
) {
    public static SeverityRule when(IssueSeverity severity) {
        return new SeverityRule(severity, null, null, null);
    }

    public SeverityRule magnitude(double min) {
        return new SeverityRule(severity, min, minSignalCount, minCategoryCount);
    }

    public SeverityRule count(int min) {
        return new SeverityRule(severity, minMagnitude, min, minCategoryCount);
    }

    public SeverityRule categories(int min) {
        return new SeverityRule(severity, minMagnitude, minSignalCount, min);
    }

    public boolean matches(SignalGroup group) {
        if (minMagnitude != null && group.negativeMagnitude() < minMagnitude) {
            return false;
        }
        if (minSignalCount != null && group.signalCount() < minSignalCount) {
            return false;
        }
        // a group always spans at least one category
        int categories = Math.max(group.categoryCount(), 1);
        return minCategoryCount == null || categories >= minCategoryCount;
    }
}
