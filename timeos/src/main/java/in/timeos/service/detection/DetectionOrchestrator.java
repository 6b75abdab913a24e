package in.timeos.service.detection;

import in.timeos.detector.DetectorRegistry;
import in.timeos.detector.SignalDetector;
import in.timeos.domain.common.SweepError;
import in.timeos.domain.signal.Signal;
import in.timeos.infrastructure.metrics.PipelineMetrics;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every registered detector on a fixed pool and stores each detector's batch.
 *
 * A detector failure is recorded and the others still run. Before insert, each
 * batch is checked against the store's active keys again, since another run may
 * have stored the same keys after the detector loaded its index. A batch is
 * inserted in one transaction.
 */
public final class DetectionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final DetectorRegistry registry;
    private final SignalRepository signalRepository;
    private final PipelineMetrics metrics;
    private final ExecutorService pool;

    public DetectionOrchestrator(DetectorRegistry registry, SignalRepository signalRepository,
                                 PipelineMetrics metrics, int threads) {
        this.registry = registry;
        this.signalRepository = signalRepository;
        this.metrics = metrics;

        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "Detector-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run all detectors.
     *
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public DetectionReport runDetection() {
        return run(registry.all());
    }

    /**
     * Run one detector by id.
     *
     * @throws IllegalArgumentException if no such detector is registered
     */
    public DetectionReport runDetector(String detectorId) {
        SignalDetector detector = registry.byId(detectorId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown detector: " + detectorId));
        return run(List.of(detector));
    }

    private DetectionReport run(List<SignalDetector> detectors) {
        Instant start = Instant.now();
        log.info("[DETECTION] Running {} detectors", detectors.size());

        List<Callable<DetectionReport.DetectorStats>> tasks = new ArrayList<>();
        for (SignalDetector detector : detectors) {
            tasks.add(() -> runOne(detector));
        }

        List<Future<DetectionReport.DetectorStats>> futures;
        try {
            futures = pool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Detection interrupted", e);
        }

        Map<String, DetectionReport.DetectorStats> byDetector = new LinkedHashMap<>();
        List<SweepError> errors = new ArrayList<>();
        StorageUnavailableException unavailable = null;
        int failed = 0;
        int detected = 0;
        int stored = 0;
        int duplicate = 0;

        for (int i = 0; i < detectors.size(); i++) {
            String id = detectors.get(i).detectorId();
            DetectionReport.DetectorStats stats;
            try {
                stats = futures.get(i).get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StorageUnavailableException sue && unavailable == null) {
                    unavailable = sue;
                }
                stats = DetectionReport.DetectorStats.failed(String.valueOf(cause.getMessage()));
                log.error("[DETECTION] Detector {} failed: {}", id, cause.getMessage(), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Detection interrupted", e);
            }

            byDetector.put(id, stats);
            if (stats.succeeded()) {
                detected += stats.detected();
                stored += stats.stored();
                duplicate += stats.duplicate();
                metrics.recordSignalsDetected(id, stats.stored());
            } else {
                failed++;
                errors.add(new SweepError(id, stats.error()));
                metrics.recordDetectorFailure(id);
            }
        }

        if (unavailable != null) {
            throw unavailable;
        }

        Duration elapsed = Duration.between(start, Instant.now());
        metrics.recordSweep("detection", elapsed, errors.size());
        log.info("[DETECTION] ✓ {} run, {} failed, {} detected, {} stored, {} duplicate ({} ms)",
            detectors.size(), failed, detected, stored, duplicate, elapsed.toMillis());

        return new DetectionReport(detectors.size(), failed, detected, stored, duplicate, errors, byDetector);
    }

    private DetectionReport.DetectorStats runOne(SignalDetector detector) {
        List<Signal> signals = detector.detect();
        if (signals.isEmpty()) {
            return new DetectionReport.DetectorStats(0, 0, 0, null);
        }

        Set<String> taken = new HashSet<>(signalRepository.findActiveKeys(detector.signalTypes()));
        List<Signal> fresh = new ArrayList<>();
        for (Signal signal : signals) {
            if (taken.add(signal.dedupKey())) {
                fresh.add(signal);
            }
        }

        int storedCount = fresh.isEmpty() ? 0 : signalRepository.insertAll(fresh);
        int duplicates = signals.size() - fresh.size();
        if (duplicates > 0) {
            log.info("[DETECTION] {}: skipped {} duplicates", detector.detectorId(), duplicates);
        }
        return new DetectionReport.DetectorStats(signals.size(), storedCount, duplicates, null);
    }

    /**
     * Stop the detector pool.
     */
    public void shutdown() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
