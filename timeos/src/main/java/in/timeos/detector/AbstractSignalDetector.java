package in.timeos.detector;

import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalSource;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for detectors: per-run dedup index, signal construction and magnitude helpers.
 *
 * Subclasses implement {@link #scan(List)} and call {@link #emit(List, Signal.Builder)}
 * for every candidate. An emission that fails validation is logged and skipped; it
 * never aborts the run.
 */
public abstract class AbstractSignalDetector implements SignalDetector {
    private static final Logger log = LoggerFactory.getLogger(AbstractSignalDetector.class);

    protected final ScopeResolver scopeResolver;
    protected final Clock clock;

    private final SignalRepository signalRepository;
    private final ActiveSignalIndex index = new ActiveSignalIndex();

    protected AbstractSignalDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, Clock clock) {
        this.signalRepository = signalRepository;
        this.scopeResolver = scopeResolver;
        this.clock = clock;
    }

    @Override
    public final List<Signal> detect() {
        log.info("[{}] Starting detection (v{})", detectorId(), detectorVersion());

        index.rebuild(signalRepository.findActiveKeys(signalTypes()));

        List<Signal> signals = new ArrayList<>();
        scan(signals);

        log.info("[{}] Detected {} signals", detectorId(), signals.size());
        return signals;
    }

    /**
     * Read the source and emit candidates into {@code out}.
     */
    protected abstract void scan(List<Signal> out);

    /**
     * True if an ACTIVE signal (or one emitted earlier in this run) exists for the pair.
     */
    protected boolean signalExists(String signalType, String entityId) {
        return index.contains(Signal.dedupKey(signalType, entityId));
    }

    /**
     * Build the draft and add it to {@code out} unless its key is already taken.
     *
     * @return true if a signal was added
     */
    protected boolean emit(List<Signal> out, Signal.Builder draft) {
        Instant now = now();
        Signal signal;
        try {
            signal = draft
                .detector(detectorId(), detectorVersion())
                .detectedAt(now)
                .createdAt(now)
                .build();
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Dropped invalid signal: {}", detectorId(), e.getMessage());
            return false;
        }

        if (!index.add(signal.dedupKey())) {
            return false;
        }
        out.add(signal);
        log.debug("[{}] Signal: {} valence={} magnitude={} entity={}:{}",
            detectorId(), signal.signalType(), signal.valence(),
            String.format("%.2f", signal.magnitude()), signal.entityType(), signal.entityId());
        return true;
    }

    /**
     * Start a draft with type, entity and source filled in.
     */
    protected Signal.Builder draft(String signalType, String entityType, String entityId, SignalSource source) {
        return Signal.builder()
            .signalType(signalType)
            .entity(entityType, entityId)
            .sourceType(source);
    }

    protected Instant now() {
        return clock.instant();
    }

    protected LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    // ========================================================================
    // MAGNITUDE HELPERS
    // ========================================================================

    /**
     * Magnitude for days past due: 1-3 → 0.3, 4-7 → 0.5, 8-14 → 0.7, 15-30 → 0.85, 31+ → 1.0.
     */
    public static double overdueMagnitude(long days) {
        if (days <= 0) return 0.0;
        if (days <= 3) return 0.3;
        if (days <= 7) return 0.5;
        if (days <= 14) return 0.7;
        if (days <= 30) return 0.85;
        return 1.0;
    }

    /**
     * Magnitude for a monetary amount: under 5k → 0.3, 20k → 0.5, 50k → 0.7, 100k → 0.85, else 1.0.
     */
    public static double amountMagnitude(double amount) {
        if (amount < 5_000) return 0.3;
        if (amount < 20_000) return 0.5;
        if (amount < 50_000) return 0.7;
        if (amount < 100_000) return 0.85;
        return 1.0;
    }

    public static double scaleMagnitude(double value, double min, double max) {
        return scaleMagnitude(value, min, max, 0.3, 1.0);
    }

    /**
     * Linear map of {@code value} from [min, max] onto [minMag, maxMag], clamped.
     */
    public static double scaleMagnitude(double value, double min, double max, double minMag, double maxMag) {
        if (max <= min) {
            return minMag;
        }
        double ratio = (value - min) / (max - min);
        ratio = Math.max(0.0, Math.min(1.0, ratio));
        return minMag + ratio * (maxMag - minMag);
    }
}
