package in.timeos.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics sink that drops everything. Used by tests and tools that run a single sweep.
 */
public final class NoOpPipelineMetrics implements PipelineMetrics {
    public static final NoOpPipelineMetrics INSTANCE = new NoOpPipelineMetrics();

    private NoOpPipelineMetrics() {}

    @Override
    public void recordSignalsDetected(String detectorId, int count) {}

    @Override
    public void recordDetectorFailure(String detectorId) {}

    @Override
    public void recordIssueFormed(String outcome) {}

    @Override
    public void recordTransition(String state) {}

    @Override
    public void recordRegression() {}

    @Override
    public void recordSweep(String job, Duration duration, int errors) {}
}
