package in.timeos.service.signal;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.common.SweepError;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalBalance;
import in.timeos.domain.signal.SignalStatus;
import in.timeos.infrastructure.metrics.PipelineMetrics;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalQuery;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Facade over the signal store used by the HTTP layer and manual inserts.
 *
 * Stored signals get their scope chain completed from the agency hierarchy
 * when the client level is missing.
 */
public final class SignalService {
    private static final Logger log = LoggerFactory.getLogger(SignalService.class);

    public static final int DEFAULT_SUMMARY_DAYS = 30;

    private final SignalRepository signalRepository;
    private final ScopeResolver scopeResolver;
    private final PipelineMetrics metrics;

    public SignalService(SignalRepository signalRepository, ScopeResolver scopeResolver, PipelineMetrics metrics) {
        this.signalRepository = signalRepository;
        this.scopeResolver = scopeResolver;
        this.metrics = metrics;
    }

    // ========================================================================
    // STORE
    // ========================================================================

    /**
     * Enrich and store one signal.
     *
     * @return the stored signal, with its completed scope
     */
    public Signal store(Signal signal) {
        Signal enriched = enrichScope(signal);
        signalRepository.insert(enriched);
        log.debug("Stored signal {}: {} ({})", enriched.id(), enriched.signalType(), enriched.valence());
        return enriched;
    }

    /**
     * Store signals one by one; a failing signal is recorded and the rest still go in.
     *
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public StoreResult storeAll(List<Signal> signals) {
        int stored = 0;
        List<SweepError> errors = new ArrayList<>();
        for (Signal signal : signals) {
            try {
                store(signal);
                stored++;
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("Failed to store signal {}: {}", signal.signalType(), e.getMessage());
                errors.add(SweepError.of(signal.id(), e));
            }
        }
        return new StoreResult(stored, errors);
    }

    Signal enrichScope(Signal signal) {
        ScopeChain scope = signal.scope();
        if (scope.clientId() != null) {
            return signal;
        }

        ScopeChain resolved;
        if (scope.taskId() != null) {
            resolved = scopeResolver.forTask(scope.taskId());
        } else if (scope.projectId() != null) {
            resolved = scopeResolver.forProject(scope.projectId());
        } else {
            resolved = scopeResolver.forEntity(signal.entityType(), signal.entityId());
        }

        ScopeChain merged = scope.mergeMissing(resolved);
        if (merged.equals(scope)) {
            return signal;
        }
        return signal.toBuilder().scope(merged).build();
    }

    // ========================================================================
    // READ
    // ========================================================================

    public Optional<Signal> get(String signalId) {
        return signalRepository.findById(signalId);
    }

    public List<Signal> list(SignalQuery query) {
        return signalRepository.query(query);
    }

    /**
     * @param includeInactive when false only ACTIVE signals are returned
     */
    public List<Signal> forEntity(String entityType, String entityId, boolean includeInactive) {
        return signalRepository.findByEntity(entityType, entityId, includeInactive ? null : SignalStatus.ACTIVE);
    }

    public List<Signal> forScope(ScopeLevel level, String scopeId, Integer valence) {
        return signalRepository.findByScope(level, scopeId, null, valence);
    }

    /**
     * @param level optional; applied together with {@code scopeId}
     */
    public SignalSummary summary(ScopeLevel level, String scopeId, int windowDays) {
        return SignalSummary.of(signalRepository.countByCategory(level, scopeId, windowDays), windowDays, level, scopeId);
    }

    public SignalBalance balanceForScope(ScopeLevel level, String scopeId) {
        return signalRepository.balanceForScope(level, scopeId);
    }

    // ========================================================================
    // MAINTENANCE
    // ========================================================================

    /**
     * Expire active signals past their expires_at.
     */
    public int expireOldSignals() {
        Instant start = Instant.now();
        int count = signalRepository.expireOldSignals();
        metrics.recordSweep("expiry", Duration.between(start, Instant.now()), 0);
        if (count > 0) {
            log.info("Expired {} signals", count);
        }
        return count;
    }
}
