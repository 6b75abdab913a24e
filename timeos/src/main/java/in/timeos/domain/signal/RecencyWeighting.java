package in.timeos.domain.signal;

import java.time.Duration;
import java.time.Instant;

/**
 * Age-based decay applied to signal magnitudes when aggregating.
 *
 * <pre>
 * age &gt; 365d -&gt; 0.1
 * age &gt; 180d -&gt; 0.25
 * age &gt;  90d -&gt; 0.5
 * age &gt;  30d -&gt; 0.8
 * otherwise  -&gt; 1.0
 * </pre>
 */
public final class RecencyWeighting {

    private static final Duration YEAR = Duration.ofDays(365);
    private static final Duration HALF_YEAR = Duration.ofDays(180);
    private static final Duration QUARTER = Duration.ofDays(90);
    private static final Duration MONTH = Duration.ofDays(30);

    public static double weight(Instant detectedAt, Instant now) {
        Duration age = Duration.between(detectedAt, now);
        if (age.compareTo(YEAR) > 0) return 0.1;
        if (age.compareTo(HALF_YEAR) > 0) return 0.25;
        if (age.compareTo(QUARTER) > 0) return 0.5;
        if (age.compareTo(MONTH) > 0) return 0.8;
        return 1.0;
    }

    public static double weightedMagnitude(Signal signal, Instant now) {
        return signal.magnitude() * weight(signal.detectedAt(), now);
    }

    private RecencyWeighting() {}
}
