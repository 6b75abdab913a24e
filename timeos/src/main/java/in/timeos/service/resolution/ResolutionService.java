package in.timeos.service.resolution;

import in.timeos.domain.common.SweepError;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.ResolutionMethod;
import in.timeos.domain.issue.StateChange;
import in.timeos.domain.signal.RecencyWeighting;
import in.timeos.domain.signal.Signal;
import in.timeos.infrastructure.metrics.PipelineMetrics;
import in.timeos.repository.IssueRepository;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Issue lifecycle after formation: human transitions, resolution into monitoring,
 * regression detection and closure.
 *
 * <pre>
 * DETECTED -> SURFACED -> ACKNOWLEDGED -> ADDRESSING -> MONITORING -> CLOSED
 *                ^                                         |
 *                +--------------- regression --------------+
 * </pre>
 *
 * Every transition appends to the issue's state history. Invalid transitions
 * return false and write nothing.
 */
public final class ResolutionService {
    private static final Logger log = LoggerFactory.getLogger(ResolutionService.class);

    public static final int MONITORING_DAYS = 90;
    public static final int REGRESSION_SIGNAL_COUNT = 3;
    public static final double REGRESSION_MAGNITUDE = 1.5;

    private final IssueRepository issueRepository;
    private final SignalRepository signalRepository;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public ResolutionService(IssueRepository issueRepository, SignalRepository signalRepository,
                             PipelineMetrics metrics) {
        this(issueRepository, signalRepository, metrics, Clock.systemUTC());
    }

    public ResolutionService(IssueRepository issueRepository, SignalRepository signalRepository,
                             PipelineMetrics metrics, Clock clock) {
        this.issueRepository = issueRepository;
        this.signalRepository = signalRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========================================================================
    // HUMAN TRANSITIONS
    // ========================================================================

    /**
     * SURFACED -> ACKNOWLEDGED.
     */
    public boolean acknowledge(String issueId, String actor) {
        Optional<Issue> found = issueRepository.findById(issueId);
        if (found.isEmpty() || found.get().state() != IssueState.SURFACED) {
            return false;
        }
        Instant now = clock.instant();
        Issue updated = found.get().toBuilder()
            .state(IssueState.ACKNOWLEDGED)
            .acknowledged(now, actor)
            .appendHistory(new StateChange(IssueState.ACKNOWLEDGED, now, actorOrSystem(actor), null))
            .updatedAt(now)
            .build();
        return write(updated, "acknowledged by " + actorOrSystem(actor));
    }

    /**
     * SURFACED or ACKNOWLEDGED -> ADDRESSING.
     */
    public boolean startAddressing(String issueId, String actor) {
        Optional<Issue> found = issueRepository.findById(issueId);
        if (found.isEmpty()) {
            return false;
        }
        IssueState state = found.get().state();
        if (state != IssueState.SURFACED && state != IssueState.ACKNOWLEDGED) {
            return false;
        }
        Instant now = clock.instant();
        Issue updated = found.get().toBuilder()
            .state(IssueState.ADDRESSING)
            .addressingStartedAt(now)
            .appendHistory(new StateChange(IssueState.ADDRESSING, now, actorOrSystem(actor), null))
            .updatedAt(now)
            .build();
        return write(updated, "addressing by " + actorOrSystem(actor));
    }

    /**
     * Resolve an open issue and start its monitoring window. History records
     * RESOLVED followed by MONITORING.
     *
     * @return false if the issue is missing, monitoring or closed
     */
    public boolean resolve(String issueId, ResolutionMethod method, String resolvedBy, String notes) {
        Optional<Issue> found = issueRepository.findById(issueId);
        if (found.isEmpty() || !found.get().isOpen()) {
            return false;
        }
        Instant now = clock.instant();
        Instant monitoringUntil = now.plus(Duration.ofDays(MONITORING_DAYS));
        String actor = actorOrSystem(resolvedBy);

        Issue updated = found.get().toBuilder()
            .state(IssueState.MONITORING)
            .resolved(now, method, actor, notes)
            .monitoringUntil(monitoringUntil)
            .appendHistory(new StateChange(IssueState.RESOLVED, now, actor, method.name()))
            .appendHistory(new StateChange(IssueState.MONITORING, now, actor, "until " + monitoringUntil))
            .updatedAt(now)
            .build();
        return write(updated, "resolved via " + method + ", monitoring until " + monitoringUntil);
    }

    /**
     * Close an issue as not relevant. Not allowed from MONITORING or CLOSED.
     */
    public boolean dismiss(String issueId, String actor, String reason) {
        Optional<Issue> found = issueRepository.findById(issueId);
        if (found.isEmpty()) {
            return false;
        }
        IssueState state = found.get().state();
        if (state.isTerminal() || state == IssueState.MONITORING) {
            return false;
        }
        Instant now = clock.instant();
        Issue updated = found.get().toBuilder()
            .state(IssueState.CLOSED)
            .resolved(now, ResolutionMethod.DISMISSED, actorOrSystem(actor), reason)
            .closedAt(now)
            .appendHistory(new StateChange(IssueState.CLOSED, now, actorOrSystem(actor), reason))
            .updatedAt(now)
            .build();
        return write(updated, "dismissed by " + actorOrSystem(actor));
    }

    // ========================================================================
    // SWEEPS
    // ========================================================================

    /**
     * Reopen monitoring issues with new negative signals since resolution, then
     * close monitoring issues whose window has elapsed.
     *
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public RegressionReport checkRegressions() {
        Instant start = clock.instant();
        List<String> regressed = new ArrayList<>();
        List<SweepError> errors = new ArrayList<>();

        for (Issue issue : issueRepository.findMonitoringActive(start)) {
            try {
                if (isRegressing(issue)) {
                    reopen(issue);
                    regressed.add(issue.id());
                }
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("[RESOLUTION] Regression check failed for {}: {}", issue.id(), e.getMessage(), e);
                errors.add(SweepError.of(issue.id(), e));
            }
        }

        int closed = 0;
        for (Issue issue : issueRepository.findMonitoringExpired(clock.instant())) {
            try {
                if (close(issue)) {
                    closed++;
                }
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("[RESOLUTION] Failed to close {}: {}", issue.id(), e.getMessage(), e);
                errors.add(SweepError.of(issue.id(), e));
            }
        }

        if (!regressed.isEmpty()) {
            log.warn("[RESOLUTION] Detected {} regressions", regressed.size());
        }
        if (closed > 0) {
            log.info("[RESOLUTION] Closed {} issues after monitoring", closed);
        }
        metrics.recordSweep("regressions", Duration.between(start, clock.instant()), errors.size());
        return new RegressionReport(regressed, closed, errors);
    }

    /**
     * Auto-resolve ADDRESSING issues whose signal balance has reached zero or better.
     *
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public ResolutionCheckReport runResolutionCheck() {
        Instant start = clock.instant();
        int checked = 0;
        int autoResolved = 0;
        List<SweepError> errors = new ArrayList<>();

        for (Issue issue : issueRepository.findByState(IssueState.ADDRESSING)) {
            checked++;
            try {
                if (issue.netScore() >= 0
                        && resolve(issue.id(), ResolutionMethod.SIGNALS_BALANCED, StateChange.SYSTEM, null)) {
                    autoResolved++;
                }
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("[RESOLUTION] Resolution check failed for {}: {}", issue.id(), e.getMessage(), e);
                errors.add(SweepError.of(issue.id(), e));
            }
        }

        metrics.recordSweep("resolution", Duration.between(start, clock.instant()), errors.size());
        log.info("[RESOLUTION] ✓ {} checked, {} auto-resolved", checked, autoResolved);
        return new ResolutionCheckReport(checked, autoResolved, errors);
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    boolean isRegressing(Issue issue) {
        if (issue.resolvedAt() == null || issue.scopeType() == null) {
            return false;
        }
        Instant now = clock.instant();
        List<Signal> fresh = signalRepository.findNegativeSince(issue.scopeType(), issue.scopeId(), issue.resolvedAt());
        double magnitude = 0;
        for (Signal signal : fresh) {
            magnitude += RecencyWeighting.weightedMagnitude(signal, now);
        }
        return fresh.size() >= REGRESSION_SIGNAL_COUNT || magnitude >= REGRESSION_MAGNITUDE;
    }

    private void reopen(Issue issue) {
        Instant now = clock.instant();
        Issue reopened = issue.toBuilder()
            .state(IssueState.SURFACED)
            .regressionCount(issue.regressionCount() + 1)
            .lastRegressionAt(now)
            .resolved(null, null, null, null)
            .monitoringUntil(null)
            .surfacedAt(now)
            .appendHistory(StateChange.system(IssueState.SURFACED, now, "Regression detected"))
            .updatedAt(now)
            .build();
        issueRepository.update(reopened);
        metrics.recordRegression();
        metrics.recordTransition(IssueState.SURFACED.name());
        log.warn("[RESOLUTION] Issue {} regressed and reopened (regression #{})",
            issue.id(), reopened.regressionCount());
    }

    private boolean close(Issue issue) {
        Instant now = clock.instant();
        Issue closed = issue.toBuilder()
            .state(IssueState.CLOSED)
            .closedAt(now)
            .appendHistory(StateChange.system(IssueState.CLOSED, now, "Monitoring period completed"))
            .updatedAt(now)
            .build();
        boolean updated = issueRepository.update(closed);
        if (updated) {
            metrics.recordTransition(IssueState.CLOSED.name());
        }
        return updated;
    }

    private boolean write(Issue updated, String what) {
        boolean ok = issueRepository.update(updated);
        if (ok) {
            metrics.recordTransition(updated.state().name());
            log.info("[RESOLUTION] Issue {} {}", updated.id(), what);
        }
        return ok;
    }

    private static String actorOrSystem(String actor) {
        return actor == null || actor.isBlank() ? StateChange.SYSTEM : actor;
    }
}
