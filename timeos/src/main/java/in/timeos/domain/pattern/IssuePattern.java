package in.timeos.domain.pattern;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueType;
import in.timeos.domain.issue.RecommendedUrgency;
import in.timeos.domain.signal.SignalGroup;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative rule defining when a group of signals constitutes an issue.
 */
public record IssuePattern(
    IssueType issueType,
    String issueSubtype,
    ScopeLevel scopeLevel,
    List<String> requiredSignalTypes,
    List<String> optionalSignalTypes,
    int minSignalCount,
    double minNegativeMagnitude,
    List<SeverityRule> severityRules,
    String headlineTemplate,
    String descriptionTemplate,
    String recommendedActionTemplate,
    String recommendedOwnerRole,
    RecommendedUrgency recommendedUrgency
) {
    public IssuePattern {
        if (issueSubtype == null || issueSubtype.isBlank()) {
            throw new IllegalArgumentException("Pattern subtype is required");
        }
        if (scopeLevel == null || !scopeLevel.isIssueScope()) {
            throw new IllegalArgumentException("Pattern " + issueSubtype + " has invalid scope level " + scopeLevel);
        }
        requiredSignalTypes = List.copyOf(requiredSignalTypes);
        optionalSignalTypes = List.copyOf(optionalSignalTypes);
        severityRules = List.copyOf(severityRules);
        if (requiredSignalTypes.isEmpty() && optionalSignalTypes.isEmpty()) {
            throw new IllegalArgumentException("Pattern " + issueSubtype + " matches no signal types");
        }
    }

    /**
     * Required and optional types, deduplicated, in declaration order.
     */
    public List<String> allSignalTypes() {
        Set<String> types = new LinkedHashSet<>(requiredSignalTypes);
        types.addAll(optionalSignalTypes);
        return new ArrayList<>(types);
    }

    /**
     * First matching severity rule; MEDIUM when none matches.
     */
    public IssueSeverity severityFor(SignalGroup group) {
        for (SeverityRule rule : severityRules) {
            if (rule.matches(group)) {
                return rule.severity();
            }
        }
        return IssueSeverity.MEDIUM;
    }

    public boolean qualifies(SignalGroup group) {
        return group.signalCount() >= minSignalCount
            && group.negativeMagnitude() >= minNegativeMagnitude;
    }
}
