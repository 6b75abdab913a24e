package in.timeos.domain.signal;

/**
 * Active signal counts of one category, split by valence.
 */
public record CategoryCounts(long negative, long neutral, long positive) {

    public static final CategoryCounts ZERO = new CategoryCounts(0, 0, 0);

    public CategoryCounts plus(int valence, long count) {
        if (valence < 0) return new CategoryCounts(negative + count, neutral, positive);
        if (valence > 0) return new CategoryCounts(negative, neutral, positive + count);
        return new CategoryCounts(negative, neutral + count, positive);
    }

    public long total() {
        return negative + neutral + positive;
    }
}
