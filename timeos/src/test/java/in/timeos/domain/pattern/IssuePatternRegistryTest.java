package in.timeos.domain.pattern;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueType;
import in.timeos.domain.signal.SignalBalance;
import in.timeos.domain.signal.SignalGroup;
import in.timeos.domain.signal.SignalTypes;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IssuePatternRegistryTest {

    private static SignalGroup group(int count, double negMag, int categories) {
        List<String> ids = Collections.nCopies(count, "s");
        return new SignalGroup("X", ids, new SignalBalance(count, 0, 0, negMag, 0.0), categories);
    }

    @Test
    void defaults_registerEightPatterns() {
        IssuePatternRegistry registry = IssuePatternRegistry.defaults();

        assertEquals(8, registry.size());
        assertTrue(registry.bySubtype(IssuePatternRegistry.DEADLINE_RISK).isPresent());
        assertTrue(registry.bySubtype(IssuePatternRegistry.RELATIONSHIP_AT_RISK).isPresent());
        assertEquals(2, registry.byType(IssueType.SCHEDULE_DELIVERY).size());
    }

    @Test
    void duplicateSubtype_isRejected() {
        IssuePattern p = IssuePatternRegistry.deadlineRisk();
        assertThrows(IllegalArgumentException.class, () -> new IssuePatternRegistry(List.of(p, p)));
    }

    @Test
    void deadlineRisk_severityFollowsFirstMatchingRule() {
        IssuePattern p = IssuePatternRegistry.deadlineRisk();

        assertEquals(IssueSeverity.CRITICAL, p.severityFor(group(10, 5.0, 1)));
        assertEquals(IssueSeverity.HIGH, p.severityFor(group(6, 3.5, 1)));
        assertEquals(IssueSeverity.MEDIUM, p.severityFor(group(3, 1.5, 1)));
        // many signals but low magnitude falls through to the default
        assertEquals(IssueSeverity.MEDIUM, p.severityFor(group(12, 1.0, 1)));
    }

    @Test
    void relationshipAtRisk_countsDistinctCategories() {
        IssuePattern p = IssuePatternRegistry.relationshipAtRisk();

        assertEquals(IssueSeverity.CRITICAL, p.severityFor(group(6, 5.5, 4)));
        assertEquals(IssueSeverity.HIGH, p.severityFor(group(6, 5.5, 3)));
        assertTrue(p.requiredSignalTypes().isEmpty());
        assertTrue(p.allSignalTypes().contains(SignalTypes.ESCALATION_DETECTED));
    }

    @Test
    void qualifies_needsCountAndMagnitude() {
        IssuePattern p = IssuePatternRegistry.deadlineRisk();

        assertTrue(p.qualifies(group(3, 1.5, 1)));
        assertFalse(p.qualifies(group(2, 3.0, 1)));
        assertFalse(p.qualifies(group(5, 1.4, 1)));
    }

    @Test
    void pattern_rejectsPersonScope() {
        assertThrows(IllegalArgumentException.class, () -> new IssuePattern(
            IssueType.QUALITY, "x", ScopeLevel.PERSON, List.of(SignalTypes.TASK_OVERDUE), List.of(),
            1, 0.1, List.of(), "h", "d", "a", "pm", null));
    }

    @Test
    void ruleWithoutThresholds_matchesEveryGroup() {
        assertTrue(SeverityRule.when(IssueSeverity.HIGH).matches(group(1, 0.0, 0)));
    }
}
