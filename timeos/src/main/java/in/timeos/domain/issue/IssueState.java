package in.timeos.domain.issue;

/**
 * Issue lifecycle state.
 *
 * detected -> surfaced -> acknowledged -> addressing -> monitoring -> closed,
 * with monitoring -> surfaced on regression.
 */
public enum IssueState {
    /**
     * Formed below the surfacing priority; not shown by default.
     */
    DETECTED,

    /**
     * Visible and awaiting a human.
     */
    SURFACED,

    /**
     * Someone has seen it.
     */
    ACKNOWLEDGED,

    /**
     * Work in progress; eligible for auto-resolution once signals balance.
     */
    ADDRESSING,

    /**
     * Only ever written to state history, immediately followed by MONITORING.
     */
    RESOLVED,

    /**
     * Resolved and watched for regression until monitoring_until.
     */
    MONITORING,

    /**
     * Terminal.
     */
    CLOSED;

    /**
     * Open issues block formation of a second issue for the same subtype and scope.
     */
    public boolean isOpen() {
        return switch (this) {
            case DETECTED, SURFACED, ACKNOWLEDGED, ADDRESSING -> true;
            case RESOLVED, MONITORING, CLOSED -> false;
        };
    }

    /**
     * No transition leaves a terminal state.
     */
    public boolean isTerminal() {
        return switch (this) {
            case CLOSED -> true;
            case DETECTED, SURFACED, ACKNOWLEDGED, ADDRESSING, RESOLVED, MONITORING -> false;
        };
    }
}
