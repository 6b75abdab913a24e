package in.timeos.service.detection;

import in.timeos.domain.common.SweepError;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one detection run across detectors.
 */
public record DetectionReport(
    int detectorsRun,
    int detectorsFailed,
    int signalsDetected,
    int signalsStored,
    int signalsDuplicate,
    List<SweepError> errors,
    Map<String, DetectorStats> byDetector
) {
    public DetectionReport {
        errors = List.copyOf(errors);
        byDetector = Map.copyOf(byDetector);
    }

    /**
     * Per-detector counts. {@code error} is null when the detector succeeded.
     */
    public record DetectorStats(int detected, int stored, int duplicate, String error) {
        public static DetectorStats failed(String error) {
            return new DetectorStats(0, 0, 0, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }
}
