package in.timeos.domain.pattern;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueType;
import in.timeos.domain.issue.RecommendedUrgency;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static in.timeos.domain.signal.SignalTypes.*;

/**
 * Immutable, explicitly constructed set of issue patterns.
 */
public final class IssuePatternRegistry {

    private final List<IssuePattern> patterns;
    private final Map<String, IssuePattern> bySubtype;

    public IssuePatternRegistry(List<IssuePattern> patterns) {
        Map<String, IssuePattern> index = new LinkedHashMap<>();
        for (IssuePattern p : patterns) {
            if (index.putIfAbsent(p.issueSubtype(), p) != null) {
                throw new IllegalArgumentException("Duplicate pattern subtype: " + p.issueSubtype());
            }
        }
        this.patterns = List.copyOf(patterns);
        this.bySubtype = index;
    }

    public List<IssuePattern> all() {
        return patterns;
    }

    public Optional<IssuePattern> bySubtype(String issueSubtype) {
        return Optional.ofNullable(bySubtype.get(issueSubtype));
    }

    public List<IssuePattern> byType(IssueType issueType) {
        return patterns.stream().filter(p -> p.issueType() == issueType).toList();
    }

    public int size() {
        return patterns.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // Built-in patterns
    // ═══════════════════════════════════════════════════════════════

    public static final String DEADLINE_RISK = "deadline_risk";
    public static final String DELIVERY_CRISIS = "delivery_crisis";
    public static final String REVISION_OVERLOAD = "revision_overload";
    public static final String APPROVAL_STALL = "approval_stall";
    public static final String AR_AGING = "ar_aging";
    public static final String ENGAGEMENT_DECLINE = "engagement_decline";
    public static final String ESCALATION_ACTIVE = "escalation_active";
    public static final String RELATIONSHIP_AT_RISK = "relationship_at_risk";

    public static IssuePatternRegistry defaults() {
        return new IssuePatternRegistry(List.of(
            deadlineRisk(),
            deliveryCrisis(),
            revisionOverload(),
            approvalStall(),
            arAging(),
            engagementDecline(),
            escalationActive(),
            relationshipAtRisk()
        ));
    }

    static IssuePattern deadlineRisk() {
        return new IssuePattern(
            IssueType.SCHEDULE_DELIVERY, DEADLINE_RISK, ScopeLevel.PROJECT,
            List.of(TASK_OVERDUE, TASK_APPROACHING),
            List.of(TASK_BLOCKED, TASK_DUE_MOVED_OUT),
            3, 1.5,
            List.of(
                SeverityRule.when(IssueSeverity.CRITICAL).count(10).magnitude(5.0),
                SeverityRule.when(IssueSeverity.HIGH).count(5).magnitude(3.0),
                SeverityRule.when(IssueSeverity.MEDIUM).count(3).magnitude(1.5)
            ),
            "{scope_name}: {overdue_count} overdue, {approaching_count} approaching",
            "Delivery at risk. {overdue_count} tasks overdue. {approaching_count} approaching deadline.",
            "Review task priorities, reassign or escalate blockers",
            "pm", RecommendedUrgency.THIS_WEEK
        );
    }

    static IssuePattern deliveryCrisis() {
        return new IssuePattern(
            IssueType.SCHEDULE_DELIVERY, DELIVERY_CRISIS, ScopeLevel.PROJECT,
            List.of(TASK_OVERDUE),
            List.of(TASK_BLOCKED, TASK_COMPLETED_LATE),
            10, 5.0,
            List.of(SeverityRule.when(IssueSeverity.CRITICAL).count(10).magnitude(5.0)),
            "{scope_name}: DELIVERY CRISIS - {overdue_count} overdue",
            "Critical delivery failure. {overdue_count} tasks overdue. Immediate intervention required.",
            "Emergency triage: identify critical path, reassign resources, client communication",
            "account_lead", RecommendedUrgency.IMMEDIATE
        );
    }

    static IssuePattern revisionOverload() {
        // revision depth is not part of the aggregate, so the rule carries no thresholds
        return new IssuePattern(
            IssueType.QUALITY, REVISION_OVERLOAD, ScopeLevel.TASK,
            List.of(REVISION_CYCLE_HIGH, REVISION_CYCLE_EXCESSIVE),
            List.of(SENTIMENT_NEGATIVE, MEETING_CONCERN_RAISED),
            1, 0.5,
            List.of(SeverityRule.when(IssueSeverity.HIGH)),
            "{scope_name}: {version_count} versions",
            "Excessive revisions indicate alignment or quality issue. Review brief clarity and feedback loop.",
            "Schedule alignment call with client, review brief, assess if scope changed",
            "pm", RecommendedUrgency.THIS_WEEK
        );
    }

    static IssuePattern approvalStall() {
        return new IssuePattern(
            IssueType.QUALITY, APPROVAL_STALL, ScopeLevel.PROJECT,
            List.of(COMMUNICATION_GAP),
            List.of(RESPONSE_SLOW_CLIENT),
            1, 0.3,
            List.of(SeverityRule.when(IssueSeverity.HIGH)),
            "{scope_name}: Awaiting response ({gap_days}d)",
            "Deliverable waiting for client feedback/approval. Risk of blocking downstream work.",
            "Follow up with client, confirm receipt, request feedback timeline",
            "pm", RecommendedUrgency.THIS_WEEK
        );
    }

    static IssuePattern arAging() {
        // outstanding amount is rendered as negative magnitude x 10,000
        return new IssuePattern(
            IssueType.FINANCIAL, AR_AGING, ScopeLevel.CLIENT,
            List.of(INVOICE_OVERDUE_30, INVOICE_OVERDUE_60, INVOICE_OVERDUE_90),
            List.of(COMMUNICATION_GAP, SENTIMENT_NEGATIVE),
            1, 0.5,
            List.of(
                SeverityRule.when(IssueSeverity.CRITICAL).magnitude(5.0),
                SeverityRule.when(IssueSeverity.HIGH).magnitude(2.0),
                SeverityRule.when(IssueSeverity.MEDIUM).magnitude(0.5)
            ),
            "{scope_name}: {currency} {amount:,.0f} AR ({bucket})",
            "Invoice(s) overdue. Total: {currency} {amount:,.0f}.",
            "Finance to follow up, review payment terms, escalate if no response",
            "account_lead", RecommendedUrgency.THIS_WEEK
        );
    }

    static IssuePattern engagementDecline() {
        return new IssuePattern(
            IssueType.COMMUNICATION, ENGAGEMENT_DECLINE, ScopeLevel.CLIENT,
            List.of(COMMUNICATION_GAP),
            List.of(RESPONSE_SLOW_CLIENT, MEETING_NOSHOW_CLIENT),
            1, 0.5,
            List.of(SeverityRule.when(IssueSeverity.HIGH)),
            "{scope_name}: Engagement declining",
            "Communication frequency down. Last meaningful contact: {gap_days}d ago.",
            "Proactive outreach - schedule check-in, understand if concerns",
            "account_lead", RecommendedUrgency.THIS_WEEK
        );
    }

    static IssuePattern escalationActive() {
        return new IssuePattern(
            IssueType.COMMUNICATION, ESCALATION_ACTIVE, ScopeLevel.CLIENT,
            List.of(ESCALATION_DETECTED),
            List.of(SENTIMENT_NEGATIVE, MEETING_TITLE_URGENT),
            1, 0.8,
            List.of(SeverityRule.when(IssueSeverity.CRITICAL).count(1)),
            "{scope_name}: ESCALATION DETECTED",
            "Client using escalation language. Immediate attention required.",
            "Senior account contact within 24h, understand issue, propose resolution",
            "account_lead", RecommendedUrgency.IMMEDIATE
        );
    }

    static IssuePattern relationshipAtRisk() {
        return new IssuePattern(
            IssueType.RELATIONSHIP, RELATIONSHIP_AT_RISK, ScopeLevel.CLIENT,
            List.of(),
            List.of(
                TASK_OVERDUE,
                INVOICE_OVERDUE_30, INVOICE_OVERDUE_60, INVOICE_OVERDUE_90,
                COMMUNICATION_GAP, SENTIMENT_NEGATIVE,
                REVISION_CYCLE_HIGH, REVISION_CYCLE_EXCESSIVE,
                ESCALATION_DETECTED,
                MEETING_NOSHOW_CLIENT, MEETING_CONCERN_RAISED
            ),
            5, 3.0,
            List.of(
                SeverityRule.when(IssueSeverity.CRITICAL).categories(4).magnitude(5.0),
                SeverityRule.when(IssueSeverity.HIGH).categories(3).magnitude(3.0)
            ),
            "{scope_name}: RELATIONSHIP AT RISK",
            "Multiple issues detected across several categories. Immediate intervention needed.",
            "Executive attention: full relationship review, address all open issues, rebuild trust",
            "account_lead", RecommendedUrgency.IMMEDIATE
        );
    }
}
