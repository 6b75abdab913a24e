package in.timeos.service.core;

import in.timeos.service.balance.BalanceReport;
import in.timeos.service.balance.BalanceService;
import in.timeos.service.detection.DetectionOrchestrator;
import in.timeos.service.detection.DetectionReport;
import in.timeos.service.issue.FormationReport;
import in.timeos.service.issue.IssueFormationService;
import in.timeos.service.resolution.RegressionReport;
import in.timeos.service.resolution.ResolutionCheckReport;
import in.timeos.service.resolution.ResolutionService;
import in.timeos.service.signal.SignalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every background job, each run under its named lock.
 *
 * A full cycle runs detection, balance check, formation, resolution check and
 * regression check in that order.
 */
public final class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final DetectionOrchestrator detection;
    private final BalanceService balanceService;
    private final IssueFormationService formationService;
    private final ResolutionService resolutionService;
    private final SignalService signalService;
    private final LockedJobRunner runner;

    public PipelineOrchestrator(DetectionOrchestrator detection, BalanceService balanceService,
                                IssueFormationService formationService, ResolutionService resolutionService,
                                SignalService signalService, LockedJobRunner runner) {
        this.detection = detection;
        this.balanceService = balanceService;
        this.formationService = formationService;
        this.resolutionService = resolutionService;
        this.signalService = signalService;
        this.runner = runner;
    }

    /**
     * Run one job by name. The result is the job's report.
     */
    public Object run(Job job) {
        return switch (job) {
            case DETECTION -> runDetection();
            case BALANCE -> runBalanceCheck();
            case FORMATION -> runFormation();
            case RESOLUTION -> runResolutionCheck();
            case REGRESSIONS -> checkRegressions();
            case EXPIRY -> expireSignals();
            case PIPELINE -> runCycle();
        };
    }

    public PipelineReport runCycle() {
        return runner.run(Job.PIPELINE, () -> {
            Instant start = Instant.now();
            log.info("[PIPELINE] Starting cycle");

            DetectionReport detected = runDetection();
            BalanceReport balanced = runBalanceCheck();
            FormationReport formed = runFormation();
            ResolutionCheckReport resolved = runResolutionCheck();
            RegressionReport regressed = checkRegressions();

            log.info("[PIPELINE] ✓ Cycle complete in {} ms: {} signals stored, {} issues created, {} auto-resolved, {} regressed",
                Duration.between(start, Instant.now()).toMillis(),
                detected.signalsStored(), formed.created(), resolved.autoResolved(),
                regressed.regressedIssueIds().size());
            return new PipelineReport(detected, balanced, formed, resolved, regressed, List.of());
        }, PipelineReport::refused);
    }

    public DetectionReport runDetection() {
        return runner.run(Job.DETECTION, detection::runDetection,
            e -> new DetectionReport(0, 0, 0, 0, 0, List.of(e), Map.of()));
    }

    /**
     * Run a single detector under the detection lock.
     *
     * @throws IllegalArgumentException if no such detector is registered
     */
    public DetectionReport runDetector(String detectorId) {
        return runner.run(Job.DETECTION, () -> detection.runDetector(detectorId),
            e -> new DetectionReport(0, 0, 0, 0, 0, List.of(e), Map.of()));
    }

    public BalanceReport runBalanceCheck() {
        return runner.run(Job.BALANCE, balanceService::runBalanceCheck,
            e -> new BalanceReport(0, 0, 0, 0, List.of(e)));
    }

    public FormationReport runFormation() {
        return runner.run(Job.FORMATION, formationService::runFormation, FormationReport::failed);
    }

    public ResolutionCheckReport runResolutionCheck() {
        return runner.run(Job.RESOLUTION, resolutionService::runResolutionCheck,
            e -> new ResolutionCheckReport(0, 0, List.of(e)));
    }

    public RegressionReport checkRegressions() {
        return runner.run(Job.REGRESSIONS, resolutionService::checkRegressions,
            e -> new RegressionReport(List.of(), 0, List.of(e)));
    }

    public ExpiryReport expireSignals() {
        return runner.run(Job.EXPIRY, () -> new ExpiryReport(signalService.expireOldSignals(), List.of()),
            e -> new ExpiryReport(0, List.of(e)));
    }
}
