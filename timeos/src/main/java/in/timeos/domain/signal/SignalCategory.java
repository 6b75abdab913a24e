package in.timeos.domain.signal;

/**
 * Grouping of related signal types. Relationship-at-risk severity counts distinct categories.
 */
public enum SignalCategory {
    SCHEDULE,
    QUALITY,
    FINANCIAL,
    COMMUNICATION,
    RELATIONSHIP,
    /** Fallback for types the registry does not know. */
    PROCESS
}
