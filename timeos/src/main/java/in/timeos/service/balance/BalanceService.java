package in.timeos.service.balance;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.common.SweepError;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.ResolutionMethod;
import in.timeos.domain.issue.StateChange;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalAggregator;
import in.timeos.domain.signal.SignalBalance;
import in.timeos.infrastructure.metrics.PipelineMetrics;
import in.timeos.repository.IssueRepository;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import in.timeos.service.resolution.ResolutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cancels negative signals with matching positive ones.
 *
 * A positive signal balances the ACTIVE or CONSUMED negatives its type is paired
 * with in {@link BalanceRules}, within the scope the negative type requires.
 * Issues holding a balanced signal get their balance recomputed; ADDRESSING
 * issues whose net score reaches zero are resolved.
 */
public final class BalanceService {
    private static final Logger log = LoggerFactory.getLogger(BalanceService.class);

    public static final int BALANCE_CHECK_LIMIT = 1000;

    private final SignalRepository signalRepository;
    private final IssueRepository issueRepository;
    private final ResolutionService resolutionService;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public BalanceService(SignalRepository signalRepository, IssueRepository issueRepository,
                          ResolutionService resolutionService, PipelineMetrics metrics) {
        this(signalRepository, issueRepository, resolutionService, metrics, Clock.systemUTC());
    }

    public BalanceService(SignalRepository signalRepository, IssueRepository issueRepository,
                          ResolutionService resolutionService, PipelineMetrics metrics, Clock clock) {
        this.signalRepository = signalRepository;
        this.issueRepository = issueRepository;
        this.resolutionService = resolutionService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Apply one positive signal. Non-positive signals are ignored.
     */
    public BalanceOutcome processNewSignal(Signal positive) {
        if (!positive.isPositive() || !positive.isActive()) {
            return BalanceOutcome.NONE;
        }

        List<String> balanced = new ArrayList<>();
        for (String negativeType : BalanceRules.balancedBy(positive.signalType())) {
            if (BalanceRules.requiresSustainedBalance(negativeType) && !hasSustainedBalance(positive, negativeType)) {
                log.debug("[BALANCE] {} lacks sustained positives for {}", positive.id(), negativeType);
                continue;
            }
            for (Signal negative : candidates(positive, negativeType)) {
                if (signalRepository.markBalanced(negative.id(), positive.id())) {
                    balanced.add(negative.id());
                }
            }
        }

        if (balanced.isEmpty()) {
            return BalanceOutcome.NONE;
        }
        log.info("[BALANCE] {} ({}) balanced {} signals", positive.id(), positive.signalType(), balanced.size());

        int recalculated = 0;
        int resolved = 0;
        for (Issue issue : issueRepository.findBySignalIds(balanced)) {
            Issue refreshed = recalculate(issue);
            recalculated++;
            if (refreshed.state() == IssueState.ADDRESSING && refreshed.netScore() >= 0
                    && resolutionService.resolve(issue.id(), ResolutionMethod.SIGNALS_BALANCED,
                        StateChange.SYSTEM, "Balanced by " + positive.id())) {
                resolved++;
            }
        }
        return new BalanceOutcome(balanced, recalculated, resolved);
    }

    /**
     * Process up to {@value #BALANCE_CHECK_LIMIT} active positive signals, newest first.
     *
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public BalanceReport runBalanceCheck() {
        Instant start = clock.instant();
        List<Signal> positives = signalRepository.findActiveByValence(
            BalanceRules.allBalancingTypes(), 1, BALANCE_CHECK_LIMIT);

        int balanced = 0;
        int recalculated = 0;
        int resolved = 0;
        List<SweepError> errors = new ArrayList<>();

        for (Signal positive : positives) {
            try {
                BalanceOutcome outcome = processNewSignal(positive);
                balanced += outcome.balancedSignalIds().size();
                recalculated += outcome.issuesRecalculated();
                resolved += outcome.autoResolved();
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("[BALANCE] Failed to process {}: {}", positive.id(), e.getMessage(), e);
                errors.add(SweepError.of(positive.id(), e));
            }
        }

        metrics.recordSweep("balance", Duration.between(start, clock.instant()), errors.size());
        log.info("[BALANCE] ✓ {} positives, {} balanced, {} issues recalculated, {} auto-resolved",
            positives.size(), balanced, recalculated, resolved);
        return new BalanceReport(positives.size(), balanced, recalculated, resolved, errors);
    }

    /**
     * Recompute an issue's balance over its live (ACTIVE or CONSUMED) signals and store it.
     */
    public Issue recalculate(Issue issue) {
        Instant now = clock.instant();
        List<Signal> live = signalRepository.findByIds(issue.signalIds()).stream()
            .filter(s -> s.status().isLive())
            .toList();
        SignalBalance balance = SignalAggregator.balanceOf(live, now);

        Issue updated = issue.toBuilder().balance(balance).updatedAt(now).build();
        issueRepository.update(updated);
        log.debug("[BALANCE] Issue {} net score {} -> {}", issue.id(),
            String.format("%.2f", issue.netScore()), String.format("%.2f", balance.netScore()));
        return updated;
    }

    // ========================================================================
    // MATCHING
    // ========================================================================

    private List<Signal> candidates(Signal positive, String negativeType) {
        List<Signal> found = switch (BalanceRules.scopeMatch(negativeType)) {
            case EXACT_ENTITY -> signalRepository.findByEntity(positive.entityType(), positive.entityId(), null);
            case SAME_PROJECT -> inScope(ScopeLevel.PROJECT, positive.scope().projectId());
            case SAME_BRAND -> inScope(ScopeLevel.BRAND, positive.scope().brandId());
            case SAME_CLIENT -> inScope(ScopeLevel.CLIENT, positive.scope().clientId());
        };
        return found.stream()
            .filter(s -> s.signalType().equals(negativeType))
            .filter(Signal::isNegative)
            .filter(s -> s.status().isLive())
            .toList();
    }

    private List<Signal> inScope(ScopeLevel level, String scopeId) {
        if (scopeId == null) {
            return List.of();
        }
        return signalRepository.findByScope(level, scopeId, null, -1);
    }

    /**
     * At least {@value BalanceRules#SUSTAINED_BALANCE_COUNT} balancing positives in the
     * same client within the window, counting this one.
     */
    private boolean hasSustainedBalance(Signal positive, String negativeType) {
        String clientId = positive.scope().clientId();
        if (clientId == null) {
            return false;
        }
        Set<String> balancing = new LinkedHashSet<>(BalanceRules.balancingTypes(negativeType));
        Instant since = clock.instant().minus(Duration.ofDays(BalanceRules.SUSTAINED_BALANCE_DAYS));

        long others = signalRepository.findByScope(ScopeLevel.CLIENT, clientId, null, 1).stream()
            .filter(s -> !s.id().equals(positive.id()))
            .filter(s -> balancing.contains(s.signalType()))
            .filter(s -> s.status().isLive())
            .filter(s -> s.detectedAt().isAfter(since))
            .count();
        return others + 1 >= BalanceRules.SUSTAINED_BALANCE_COUNT;
    }
}
