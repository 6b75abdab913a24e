package in.timeos.infrastructure.metrics;

import java.time.Duration;

/**
 * Pipeline metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Signals detected per detector
 * - Detector failures
 * - Issue formation outcomes
 * - Issue state transitions and regressions
 * - Sweep duration and errors per job
 */
public interface PipelineMetrics {

    /**
     * Record signals stored by one detector run.
     */
    void recordSignalsDetected(String detectorId, int count);

    void recordDetectorFailure(String detectorId);

    /**
     * Record one formation outcome.
     *
     * @param outcome CREATED, UPDATED or UNCHANGED
     */
    void recordIssueFormed(String outcome);

    /**
     * Record an issue entering a state.
     */
    void recordTransition(String state);

    void recordRegression();

    /**
     * Record one sweep run.
     *
     * @param job job name (detection, formation, ...)
     * @param errors per-unit errors recorded by the sweep
     */
    void recordSweep(String job, Duration duration, int errors);
}
