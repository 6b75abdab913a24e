package in.timeos.service.issue;

import in.timeos.domain.common.SweepError;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.StateChange;
import in.timeos.domain.issue.Trajectory;
import in.timeos.domain.pattern.IssuePattern;
import in.timeos.domain.pattern.IssuePatternRegistry;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalGroup;
import in.timeos.infrastructure.metrics.PipelineMetrics;
import in.timeos.repository.IssueRepository;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Forms issues from active signals.
 *
 * For every pattern, active signals of the pattern's types are grouped by the
 * pattern's scope level. Each qualifying group either creates an issue or
 * updates the open issue for (subtype, scope). Contributing signals are marked
 * CONSUMED, so a later pass with no new signals finds no groups and writes nothing.
 */
public final class IssueFormationService {
    private static final Logger log = LoggerFactory.getLogger(IssueFormationService.class);

    /** Issues above this priority are surfaced on creation. */
    public static final double SURFACE_PRIORITY_THRESHOLD = 50;

    private final IssuePatternRegistry patterns;
    private final SignalRepository signalRepository;
    private final IssueRepository issueRepository;
    private final ScopeResolver scopeResolver;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public IssueFormationService(IssuePatternRegistry patterns, SignalRepository signalRepository,
                                 IssueRepository issueRepository, ScopeResolver scopeResolver,
                                 PipelineMetrics metrics) {
        this(patterns, signalRepository, issueRepository, scopeResolver, metrics, Clock.systemUTC());
    }

    public IssueFormationService(IssuePatternRegistry patterns, SignalRepository signalRepository,
                                 IssueRepository issueRepository, ScopeResolver scopeResolver,
                                 PipelineMetrics metrics, Clock clock) {
        this.patterns = patterns;
        this.signalRepository = signalRepository;
        this.issueRepository = issueRepository;
        this.scopeResolver = scopeResolver;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run formation for every registered pattern.
     *
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public FormationReport runFormation() {
        Instant start = clock.instant();
        log.info("[FORMATION] Starting issue formation ({} patterns)", patterns.size());

        List<FormationOutcome> outcomes = new ArrayList<>();
        List<SweepError> errors = new ArrayList<>();

        for (IssuePattern pattern : patterns.all()) {
            try {
                outcomes.addAll(processPattern(pattern));
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("[FORMATION] Pattern {} failed: {}", pattern.issueSubtype(), e.getMessage(), e);
                errors.add(SweepError.of(pattern.issueSubtype(), e));
            }
        }

        FormationReport report = FormationReport.of(outcomes, errors);
        metrics.recordSweep("formation", Duration.between(start, clock.instant()), errors.size());
        log.info("[FORMATION] ✓ {} created, {} updated, {} unchanged, {} errors",
            report.created(), report.updated(), report.unchanged(), errors.size());
        return report;
    }

    /**
     * Process one pattern across all scopes.
     */
    public List<FormationOutcome> processPattern(IssuePattern pattern) {
        List<SignalGroup> groups = signalRepository.findForIssueFormation(
            pattern.allSignalTypes(),
            pattern.scopeLevel(),
            pattern.minSignalCount(),
            pattern.minNegativeMagnitude()
        );

        List<FormationOutcome> outcomes = new ArrayList<>();
        Set<String> touchedScopes = new HashSet<>();
        for (SignalGroup group : groups) {
            if (group.scopeId() == null) {
                continue;
            }
            touchedScopes.add(group.scopeId());
            FormationOutcome outcome = processSignalGroup(pattern, group);
            metrics.recordIssueFormed(outcome.result().name());
            outcomes.add(outcome);
        }

        // open issues with no new signals this pass
        for (Issue open : issueRepository.findOpenBySubtype(pattern.issueSubtype())) {
            if (!touchedScopes.contains(open.scopeId())) {
                outcomes.add(new FormationOutcome(pattern.issueSubtype(), open.scopeId(), open.id(),
                    FormationOutcome.Result.UNCHANGED));
            }
        }

        log.debug("[FORMATION] {}: {} groups, {} outcomes", pattern.issueSubtype(), groups.size(), outcomes.size());
        return outcomes;
    }

    /**
     * Create or update the issue for one qualifying group.
     */
    public FormationOutcome processSignalGroup(IssuePattern pattern, SignalGroup group) {
        String scopeName = scopeResolver.scopeName(pattern.scopeLevel(), group.scopeId()).orElse(null);

        Optional<Issue> existing = issueRepository.findOpen(pattern.issueSubtype(), group.scopeId());
        if (existing.isPresent()) {
            return updateIssue(existing.get(), pattern, group, scopeName);
        }
        return createIssue(pattern, group, scopeName);
    }

    // ========================================================================
    // CREATE / UPDATE
    // ========================================================================

    private FormationOutcome createIssue(IssuePattern pattern, SignalGroup group, String scopeName) {
        Instant now = clock.instant();
        IssueSeverity severity = pattern.severityFor(group);
        double priority = PriorityCalculator.priority(severity, pattern.scopeLevel(), group.negativeMagnitude());
        IssueState state = priority > SURFACE_PRIORITY_THRESHOLD ? IssueState.SURFACED : IssueState.DETECTED;

        ScopeChain ancestors = ancestorsOf(group.signalIds());

        Issue.Builder builder = Issue.builder()
            .id(Issue.newId())
            .issueType(pattern.issueType())
            .issueSubtype(pattern.issueSubtype())
            .scope(pattern.scopeLevel(), group.scopeId())
            .ancestors(ancestors.projectId(), ancestors.retainerId(), ancestors.brandId(), ancestors.clientId())
            .headline(HeadlineRenderer.render(pattern.headlineTemplate(), group, scopeName))
            .description(HeadlineRenderer.render(pattern.descriptionTemplate(), group, scopeName))
            .severity(severity)
            .priorityScore(priority)
            .trajectory(Trajectory.STABLE)
            .signalIds(group.signalIds())
            .balance(group.balance())
            .recommendation(pattern.recommendedActionTemplate(), pattern.recommendedOwnerRole(),
                pattern.recommendedUrgency())
            .state(state)
            .appendHistory(StateChange.system(IssueState.DETECTED, now, "Formed from " + group.signalCount() + " signals"))
            .detectedAt(now)
            .createdAt(now)
            .updatedAt(now);
        if (state == IssueState.SURFACED) {
            builder.surfacedAt(now)
                .appendHistory(StateChange.system(IssueState.SURFACED, now,
                    String.format("Priority %.1f", priority)));
        }
        Issue issue = builder.build();

        issueRepository.insert(issue);
        signalRepository.markConsumed(group.signalIds(), issue.id());
        metrics.recordTransition(state.name());

        log.info("[FORMATION] Created issue {}: {} for {} ({}, priority {})",
            issue.id(), pattern.issueSubtype(), group.scopeId(), state, String.format("%.1f", priority));
        return new FormationOutcome(pattern.issueSubtype(), group.scopeId(), issue.id(), FormationOutcome.Result.CREATED);
    }

    private FormationOutcome updateIssue(Issue existing, IssuePattern pattern, SignalGroup group, String scopeName) {
        Set<String> known = new HashSet<>(existing.signalIds());
        List<String> added = group.signalIds().stream().filter(id -> !known.contains(id)).toList();
        if (added.isEmpty()) {
            return new FormationOutcome(pattern.issueSubtype(), group.scopeId(), existing.id(),
                FormationOutcome.Result.UNCHANGED);
        }

        Instant now = clock.instant();
        Set<String> signalIds = new LinkedHashSet<>(existing.signalIds());
        signalIds.addAll(added);

        // the new wave is scored on its own; the issue keeps every id it has seen
        Trajectory trajectory = Trajectory.compare(existing.balance().negativeMagnitude(), group.negativeMagnitude());
        IssueSeverity severity = pattern.severityFor(group);
        double priority = PriorityCalculator.priority(severity, pattern.scopeLevel(), group.negativeMagnitude());

        Issue updated = existing.toBuilder()
            .signalIds(new ArrayList<>(signalIds))
            .balance(group.balance())
            .trajectory(trajectory)
            .severity(severity)
            .priorityScore(priority)
            .headline(HeadlineRenderer.render(pattern.headlineTemplate(), group, scopeName))
            .description(HeadlineRenderer.render(pattern.descriptionTemplate(), group, scopeName))
            .updatedAt(now)
            .build();

        issueRepository.update(updated);
        signalRepository.markConsumed(added, existing.id());

        log.info("[FORMATION] Updated issue {}: +{} signals, trajectory={}", existing.id(), added.size(), trajectory);
        return new FormationOutcome(pattern.issueSubtype(), group.scopeId(), existing.id(), FormationOutcome.Result.UPDATED);
    }

    private ScopeChain ancestorsOf(List<String> signalIds) {
        ScopeChain chain = ScopeChain.EMPTY;
        for (Signal signal : signalRepository.findByIds(signalIds)) {
            chain = chain.mergeMissing(signal.scope());
        }
        return chain;
    }
}
