package in.timeos.domain.issue;

/**
 * Direction of an open issue's negative magnitude across formation passes.
 */
public enum Trajectory {
    WORSENING,
    STABLE,
    IMPROVING;

    private static final double WORSENING_FACTOR = 1.1;
    private static final double IMPROVING_FACTOR = 0.9;

    public static Trajectory compare(double previousMagnitude, double currentMagnitude) {
        if (currentMagnitude > previousMagnitude * WORSENING_FACTOR) {
            return WORSENING;
        }
        if (currentMagnitude < previousMagnitude * IMPROVING_FACTOR) {
            return IMPROVING;
        }
        return STABLE;
    }
}
