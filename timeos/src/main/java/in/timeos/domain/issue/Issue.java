package in.timeos.domain.issue;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.SignalBalance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A correlated, actionable problem formed from signals matching a pattern.
 *
 * Immutable; transitions produce a new instance through {@link #toBuilder()}.
 */
public record Issue(
    String id,
    IssueType issueType,
    String issueSubtype,
    ScopeLevel scopeType,
    String scopeId,
    String scopeProjectId,
    String scopeRetainerId,
    String scopeBrandId,
    String scopeClientId,
    String headline,
    String description,
    IssueSeverity severity,
    double priorityScore,
    Trajectory trajectory,
    List<String> signalIds,
    SignalBalance balance,
    String recommendedAction,
    String recommendedOwnerRole,
    RecommendedUrgency recommendedUrgency,
    IssueState state,
    int regressionCount,
    List<StateChange> stateHistory,
    Instant detectedAt,
    Instant surfacedAt,
    Instant acknowledgedAt,
    String acknowledgedBy,
    Instant addressingStartedAt,
    Instant resolvedAt,
    ResolutionMethod resolutionMethod,
    String resolvedBy,
    String resolutionNotes,
    Instant monitoringUntil,
    Instant closedAt,
    Instant lastRegressionAt,
    Instant createdAt,
    Instant updatedAt
) {
    public Issue {
        signalIds = signalIds == null ? List.of() : List.copyOf(signalIds);
        stateHistory = stateHistory == null ? List.of() : List.copyOf(stateHistory);
        if (balance == null) {
            balance = SignalBalance.EMPTY;
        }
        if (trajectory == null) {
            trajectory = Trajectory.STABLE;
        }
    }

    public static String newId() {
        return "iss_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public boolean isOpen() {
        return state.isOpen();
    }

    public boolean isMonitoring() {
        return state == IssueState.MONITORING;
    }

    public double netScore() {
        return balance.netScore();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.issueType = issueType;
        b.issueSubtype = issueSubtype;
        b.scopeType = scopeType;
        b.scopeId = scopeId;
        b.scopeProjectId = scopeProjectId;
        b.scopeRetainerId = scopeRetainerId;
        b.scopeBrandId = scopeBrandId;
        b.scopeClientId = scopeClientId;
        b.headline = headline;
        b.description = description;
        b.severity = severity;
        b.priorityScore = priorityScore;
        b.trajectory = trajectory;
        b.signalIds = new ArrayList<>(signalIds);
        b.balance = balance;
        b.recommendedAction = recommendedAction;
        b.recommendedOwnerRole = recommendedOwnerRole;
        b.recommendedUrgency = recommendedUrgency;
        b.state = state;
        b.regressionCount = regressionCount;
        b.stateHistory = new ArrayList<>(stateHistory);
        b.detectedAt = detectedAt;
        b.surfacedAt = surfacedAt;
        b.acknowledgedAt = acknowledgedAt;
        b.acknowledgedBy = acknowledgedBy;
        b.addressingStartedAt = addressingStartedAt;
        b.resolvedAt = resolvedAt;
        b.resolutionMethod = resolutionMethod;
        b.resolvedBy = resolvedBy;
        b.resolutionNotes = resolutionNotes;
        b.monitoringUntil = monitoringUntil;
        b.closedAt = closedAt;
        b.lastRegressionAt = lastRegressionAt;
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = newId();
        private IssueType issueType;
        private String issueSubtype;
        private ScopeLevel scopeType;
        private String scopeId;
        private String scopeProjectId;
        private String scopeRetainerId;
        private String scopeBrandId;
        private String scopeClientId;
        private String headline;
        private String description;
        private IssueSeverity severity = IssueSeverity.MEDIUM;
        private double priorityScore;
        private Trajectory trajectory = Trajectory.STABLE;
        private List<String> signalIds = new ArrayList<>();
        private SignalBalance balance = SignalBalance.EMPTY;
        private String recommendedAction;
        private String recommendedOwnerRole;
        private RecommendedUrgency recommendedUrgency;
        private IssueState state = IssueState.DETECTED;
        private int regressionCount;
        private List<StateChange> stateHistory = new ArrayList<>();
        private Instant detectedAt;
        private Instant surfacedAt;
        private Instant acknowledgedAt;
        private String acknowledgedBy;
        private Instant addressingStartedAt;
        private Instant resolvedAt;
        private ResolutionMethod resolutionMethod;
        private String resolvedBy;
        private String resolutionNotes;
        private Instant monitoringUntil;
        private Instant closedAt;
        private Instant lastRegressionAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder issueType(IssueType issueType) {
            this.issueType = issueType;
            return this;
        }

        public Builder issueSubtype(String issueSubtype) {
            this.issueSubtype = issueSubtype;
            return this;
        }

        public Builder scope(ScopeLevel scopeType, String scopeId) {
            this.scopeType = scopeType;
            this.scopeId = scopeId;
            return this;
        }

        public Builder ancestors(String projectId, String retainerId, String brandId, String clientId) {
            this.scopeProjectId = projectId;
            this.scopeRetainerId = retainerId;
            this.scopeBrandId = brandId;
            this.scopeClientId = clientId;
            return this;
        }

        public Builder headline(String headline) {
            this.headline = headline;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(IssueSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder priorityScore(double priorityScore) {
            this.priorityScore = priorityScore;
            return this;
        }

        public Builder trajectory(Trajectory trajectory) {
            this.trajectory = trajectory;
            return this;
        }

        public Builder signalIds(List<String> signalIds) {
            this.signalIds = new ArrayList<>(signalIds);
            return this;
        }

        public Builder balance(SignalBalance balance) {
            this.balance = balance;
            return this;
        }

        public Builder recommendation(String action, String ownerRole, RecommendedUrgency urgency) {
            this.recommendedAction = action;
            this.recommendedOwnerRole = ownerRole;
            this.recommendedUrgency = urgency;
            return this;
        }

        public Builder state(IssueState state) {
            this.state = state;
            return this;
        }

        public Builder regressionCount(int regressionCount) {
            this.regressionCount = regressionCount;
            return this;
        }

        public Builder stateHistory(List<StateChange> stateHistory) {
            this.stateHistory = new ArrayList<>(stateHistory);
            return this;
        }

        public Builder appendHistory(StateChange change) {
            this.stateHistory.add(change);
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder surfacedAt(Instant surfacedAt) {
            this.surfacedAt = surfacedAt;
            return this;
        }

        public Builder acknowledged(Instant at, String by) {
            this.acknowledgedAt = at;
            this.acknowledgedBy = by;
            return this;
        }

        public Builder addressingStartedAt(Instant addressingStartedAt) {
            this.addressingStartedAt = addressingStartedAt;
            return this;
        }

        public Builder resolved(Instant at, ResolutionMethod method, String by, String notes) {
            this.resolvedAt = at;
            this.resolutionMethod = method;
            this.resolvedBy = by;
            this.resolutionNotes = notes;
            return this;
        }

        public Builder monitoringUntil(Instant monitoringUntil) {
            this.monitoringUntil = monitoringUntil;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder lastRegressionAt(Instant lastRegressionAt) {
            this.lastRegressionAt = lastRegressionAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Issue build() {
            return new Issue(
                id, issueType, issueSubtype, scopeType, scopeId,
                scopeProjectId, scopeRetainerId, scopeBrandId, scopeClientId,
                headline, description, severity, priorityScore, trajectory,
                signalIds, balance,
                recommendedAction, recommendedOwnerRole, recommendedUrgency,
                state, regressionCount, stateHistory,
                detectedAt, surfacedAt, acknowledgedAt, acknowledgedBy, addressingStartedAt,
                resolvedAt, resolutionMethod, resolvedBy, resolutionNotes,
                monitoringUntil, closedAt, lastRegressionAt,
                createdAt, updatedAt
            );
        }
    }
}
