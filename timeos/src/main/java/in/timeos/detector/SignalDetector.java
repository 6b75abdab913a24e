package in.timeos.detector;

import in.timeos.domain.signal.Signal;

import java.util.List;
import java.util.Set;

/**
 * Turns one external source into signals.
 *
 * Implementations emit at most one signal per (type, entity) that has no ACTIVE
 * counterpart in the store. They do not persist anything.
 */
public interface SignalDetector {
    String detectorId();

    String detectorVersion();

    /**
     * Signal types this detector may emit.
     */
    Set<String> signalTypes();

    /**
     * Run one detection pass.
     *
     * @throws in.timeos.detector.feed.FeedUnavailableException if the source cannot be read
     */
    List<Signal> detect();
}
