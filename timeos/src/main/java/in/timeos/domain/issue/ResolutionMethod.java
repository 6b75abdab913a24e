package in.timeos.domain.issue;

/**
 * How an issue left the open states.
 */
public enum ResolutionMethod {
    SIGNALS_BALANCED,
    TASKS_COMPLETED,
    MANUAL,
    AUTO_EXPIRED,
    DISMISSED
}
