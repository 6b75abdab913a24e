package in.timeos.domain.issue;

/**
 * Top-level issue classification.
 */
public enum IssueType {
    SCHEDULE_DELIVERY,
    QUALITY,
    FINANCIAL,
    COMMUNICATION,
    RELATIONSHIP,
    PROCESS
}
