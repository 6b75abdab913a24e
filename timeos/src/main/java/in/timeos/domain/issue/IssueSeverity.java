package in.timeos.domain.issue;

/**
 * Issue severity. Each level carries the base score used for priority.
 */
public enum IssueSeverity {
    /**
     * Immediate intervention required.
     */
    CRITICAL(100),

    /**
     * Action required this week.
     */
    HIGH(70),

    /**
     * Review and monitor. Also the fallback when no severity rule matches.
     */
    MEDIUM(40),

    /**
     * Informational.
     */
    LOW(20);

    private final int baseScore;

    IssueSeverity(int baseScore) {
        this.baseScore = baseScore;
    }

    public int baseScore() {
        return baseScore;
    }
}
