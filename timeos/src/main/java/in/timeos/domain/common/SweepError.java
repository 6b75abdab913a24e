package in.timeos.domain.common;

/**
 * One failed unit of a batch sweep (a detector, a pattern, an issue).
 */
public record SweepError(String unit, String message) {

    public static SweepError of(String unit, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new SweepError(unit, message);
    }

    @Override
    public String toString() {
        return unit + ": " + message;
    }
}
