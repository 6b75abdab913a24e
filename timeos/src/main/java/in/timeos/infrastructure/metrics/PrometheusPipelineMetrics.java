package in.timeos.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of PipelineMetrics.
 *
 * Key Metrics:
 * - timeos_signals_detected_total{detector} - Signals stored per detector
 * - timeos_detector_failures_total{detector} - Failed detector runs
 * - timeos_issues_formed_total{outcome} - Formation outcomes
 * - timeos_issue_transitions_total{state} - Issues entering each state
 * - timeos_regressions_total - Monitoring issues reopened
 * - timeos_sweep_duration_seconds{job} - Sweep run time
 * - timeos_sweep_errors_total{job} - Per-unit sweep errors
 *
 * Usage:
 * <pre>
 * PrometheusPipelineMetrics metrics = new PrometheusPipelineMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusPipelineMetrics implements PipelineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusPipelineMetrics.class);

    private final CollectorRegistry registry;

    private final Counter signalsDetected;
    private final Counter detectorFailures;
    private final Counter issuesFormed;
    private final Counter transitions;
    private final Counter regressions;
    private final Histogram sweepDuration;
    private final Counter sweepErrors;

    public PrometheusPipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalsDetected = Counter.build()
            .name("timeos_signals_detected_total")
            .help("Total number of signals stored by detectors")
            .labelNames("detector")
            .register(registry);

        this.detectorFailures = Counter.build()
            .name("timeos_detector_failures_total")
            .help("Total number of failed detector runs")
            .labelNames("detector")
            .register(registry);

        this.issuesFormed = Counter.build()
            .name("timeos_issues_formed_total")
            .help("Issue formation outcomes")
            .labelNames("outcome")
            .register(registry);

        this.transitions = Counter.build()
            .name("timeos_issue_transitions_total")
            .help("Issues entering each lifecycle state")
            .labelNames("state")
            .register(registry);

        this.regressions = Counter.build()
            .name("timeos_regressions_total")
            .help("Monitoring issues reopened by new negative signals")
            .register(registry);

        this.sweepDuration = Histogram.build()
            .name("timeos_sweep_duration_seconds")
            .help("Sweep run time in seconds")
            .labelNames("job")
            .buckets(0.05, 0.1, 0.5, 1.0, 5.0, 15.0, 60.0)
            .register(registry);

        this.sweepErrors = Counter.build()
            .name("timeos_sweep_errors_total")
            .help("Per-unit errors recorded by sweeps")
            .labelNames("job")
            .register(registry);

        log.info("[METRICS] Prometheus pipeline metrics registered");
    }

    @Override
    public void recordSignalsDetected(String detectorId, int count) {
        if (count > 0) {
            signalsDetected.labels(detectorId).inc(count);
        }
    }

    @Override
    public void recordDetectorFailure(String detectorId) {
        detectorFailures.labels(detectorId).inc();
    }

    @Override
    public void recordIssueFormed(String outcome) {
        issuesFormed.labels(outcome).inc();
    }

    @Override
    public void recordTransition(String state) {
        transitions.labels(state).inc();
    }

    @Override
    public void recordRegression() {
        regressions.inc();
    }

    @Override
    public void recordSweep(String job, Duration duration, int errors) {
        sweepDuration.labels(job).observe(duration.toMillis() / 1000.0);
        if (errors > 0) {
            sweepErrors.labels(job).inc(errors);
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
