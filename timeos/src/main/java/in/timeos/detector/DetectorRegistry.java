package in.timeos.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of detectors wired at startup, in registration order.
 */
public final class DetectorRegistry {
    private final Map<String, SignalDetector> detectors = new LinkedHashMap<>();

    public DetectorRegistry(List<? extends SignalDetector> detectors) {
        for (SignalDetector detector : detectors) {
            if (this.detectors.putIfAbsent(detector.detectorId(), detector) != null) {
                throw new IllegalArgumentException("Duplicate detector id: " + detector.detectorId());
            }
        }
    }

    public List<SignalDetector> all() {
        return Collections.unmodifiableList(new ArrayList<>(detectors.values()));
    }

    public Optional<SignalDetector> byId(String detectorId) {
        return Optional.ofNullable(detectors.get(detectorId));
    }

    public int size() {
        return detectors.size();
    }
}
