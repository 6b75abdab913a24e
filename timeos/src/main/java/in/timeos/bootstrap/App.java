package in.timeos.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.timeos.detector.ChatDetector;
import in.timeos.detector.DetectorRegistry;
import in.timeos.detector.GmailDetector;
import in.timeos.detector.InvoiceDetector;
import in.timeos.detector.MeetingDetector;
import in.timeos.detector.TaskDetector;
import in.timeos.detector.feed.JsonFileFeeds;
import in.timeos.domain.pattern.IssuePatternRegistry;
import in.timeos.infrastructure.metrics.PrometheusMetricsHandler;
import in.timeos.infrastructure.metrics.PrometheusPipelineMetrics;
import in.timeos.migration.SchemaMigration;
import in.timeos.repository.IssueRepository;
import in.timeos.repository.JobLockRepository;
import in.timeos.repository.PostgresIssueRepository;
import in.timeos.repository.PostgresJobLockRepository;
import in.timeos.repository.PostgresScopeResolver;
import in.timeos.repository.PostgresSignalRepository;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;
import in.timeos.service.balance.BalanceService;
import in.timeos.service.core.LockedJobRunner;
import in.timeos.service.core.PipelineOrchestrator;
import in.timeos.service.detection.DetectionOrchestrator;
import in.timeos.service.issue.IssueFormationService;
import in.timeos.service.issue.IssueService;
import in.timeos.service.resolution.ResolutionService;
import in.timeos.service.signal.SignalService;
import in.timeos.transport.http.ApiHandlers;
import in.timeos.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Time OS signal engine: detectors, issue formation, balance and resolution sweeps, HTTP API.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        int port = Env.getInt("HTTP_PORT", 8420);
        int detectionIntervalMin = Env.getInt("DETECTION_INTERVAL_MIN", 15);
        int formationIntervalMin = Env.getInt("FORMATION_INTERVAL_MIN", 15);
        int resolutionIntervalMin = Env.getInt("RESOLUTION_INTERVAL_MIN", 60);
        int detectorThreads = Env.getInt("DETECTOR_THREADS", 4);
        Path feedDir = Path.of(Env.get("FEED_DIR", "./feeds"));

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        new SchemaMigration(dataSource).migrate();

        SignalRepository signalRepo = new PostgresSignalRepository(dataSource);
        IssueRepository issueRepo = new PostgresIssueRepository(dataSource);
        JobLockRepository jobLockRepo = new PostgresJobLockRepository(dataSource);
        ScopeResolver scopeResolver = new PostgresScopeResolver(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusPipelineMetrics metrics = new PrometheusPipelineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Detectors
        // ═══════════════════════════════════════════════════════════════
        JsonFileFeeds feeds = new JsonFileFeeds(feedDir);
        DetectorRegistry detectors = new DetectorRegistry(List.of(
            new TaskDetector(signalRepo, scopeResolver, feeds),
            new InvoiceDetector(signalRepo, scopeResolver, feeds),
            new ChatDetector(signalRepo, scopeResolver, feeds),
            new MeetingDetector(signalRepo, scopeResolver, feeds),
            new GmailDetector(signalRepo, scopeResolver, feeds.emailFeed(),
                Env.getSet("INTERNAL_EMAIL_DOMAINS", GmailDetector.DEFAULT_INTERNAL_DOMAINS))
        ));
        log.info("✓ {} detectors registered, feeds from {}", detectors.size(), feedDir.toAbsolutePath());

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        SignalService signalService = new SignalService(signalRepo, scopeResolver, metrics);
        ResolutionService resolutionService = new ResolutionService(issueRepo, signalRepo, metrics);
        BalanceService balanceService = new BalanceService(signalRepo, issueRepo, resolutionService, metrics);
        IssueFormationService formationService = new IssueFormationService(
            IssuePatternRegistry.defaults(), signalRepo, issueRepo, scopeResolver, metrics);
        IssueService issueService = new IssueService(issueRepo, resolutionService);
        DetectionOrchestrator detection = new DetectionOrchestrator(detectors, signalRepo, metrics, detectorThreads);

        PipelineOrchestrator pipeline = new PipelineOrchestrator(detection, balanceService, formationService,
            resolutionService, signalService, new LockedJobRunner(jobLockRepo));

        // ═══════════════════════════════════════════════════════════════
        // Schedulers
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService detectionScheduler = startScheduler("signal-detection", detectionIntervalMin, () -> {
            pipeline.runDetection();
            pipeline.runBalanceCheck();
        });
        ScheduledExecutorService formationScheduler = startScheduler("issue-formation", formationIntervalMin,
            pipeline::runFormation);
        ScheduledExecutorService resolutionScheduler = startScheduler("issue-resolution", resolutionIntervalMin, () -> {
            pipeline.runResolutionCheck();
            pipeline.checkRegressions();
            pipeline.expireSignals();
        });

        // ═══════════════════════════════════════════════════════════════
        // HTTP Server
        // ═══════════════════════════════════════════════════════════════
        ApiHandlers api = new ApiHandlers(signalService, issueService, pipeline);

        RoutingHandler routes = Handlers.routing()
            .get("/api/health", api::health)
            .get("/api/signals", api::signals)
            .get("/api/signals/summary", api::signalSummary)
            .get("/api/signals/{id}", api::signal)
            .get("/api/issues", api::issues)
            .get("/api/issues/{id}", api::issue)
            .post("/api/issues/{id}/acknowledge", api::acknowledgeIssue)
            .post("/api/issues/{id}/address", api::addressIssue)
            .post("/api/issues/{id}/resolve", api::resolveIssue)
            .post("/api/issues/{id}/dismiss", api::dismissIssue)
            .post("/api/jobs/detection/{detector}", api::runDetector)
            .post("/api/jobs/{job}", api::runJob)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Time OS signal engine\n\n" +
                    "API:  GET /api/health, /api/signals, /api/signals/summary, /api/issues\n" +
                    "Jobs: POST /api/jobs/{detection|balance|formation|resolution|regressions|expiry|pipeline}\n" +
                    "      POST /api/jobs/detection/{detector}\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(new BlockingHandler(routes))
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            detectionScheduler.shutdownNow();
            formationScheduler.shutdownNow();
            resolutionScheduler.shutdownNow();
            detection.shutdown();
            dataSource.close();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));
    }

    private static ScheduledExecutorService startScheduler(String name, int intervalMinutes, Runnable job) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });

        scheduler.scheduleAtFixedRate(() -> {
            try {
                job.run();
            } catch (Exception e) {
                log.error("[SCHEDULER] Error in {}: {}", name, e.getMessage(), e);
            }
        }, 1, Math.max(1, intervalMinutes), TimeUnit.MINUTES);

        log.info("[SCHEDULER] ✓ {} every {} min", name, intervalMinutes);
        return scheduler;
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/timeos");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("timeos-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
