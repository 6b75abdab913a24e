package in.timeos.domain.signal;

/**
 * Recency-weighted valence totals over a set of signals.
 */
public record SignalBalance(
    int negativeCount,
    int neutralCount,
    int positiveCount,
    double negativeMagnitude,
    double positiveMagnitude
) {
    public static final SignalBalance EMPTY = new SignalBalance(0, 0, 0, 0.0, 0.0);

    public double netScore() {
        return positiveMagnitude - negativeMagnitude;
    }

    public int totalCount() {
        return negativeCount + neutralCount + positiveCount;
    }
}
