package in.timeos.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.IssueType;
import in.timeos.domain.issue.ResolutionMethod;
import in.timeos.domain.signal.SignalStatus;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.infrastructure.metrics.NoOpPipelineMetrics;
import in.timeos.service.balance.BalanceService;
import in.timeos.service.core.LockedJobRunner;
import in.timeos.service.core.PipelineOrchestrator;
import in.timeos.service.detection.DetectionOrchestrator;
import in.timeos.service.detection.DetectionReport;
import in.timeos.service.issue.IssueFormationService;
import in.timeos.service.issue.IssueService;
import in.timeos.service.resolution.ResolutionService;
import in.timeos.service.signal.SignalService;
import in.timeos.support.InMemoryIssueRepository;
import in.timeos.support.InMemoryJobLockRepository;
import in.timeos.support.InMemorySignalRepository;
import in.timeos.support.MapScopeResolver;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static in.timeos.support.TestSignals.clientSignal;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * HTTP API against in-memory stores.
 */
public class ApiHandlersTest {

    private static final int TEST_PORT = 19091;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private Undertow server;
    private HttpClient httpClient;
    private InMemorySignalRepository signals;
    private InMemoryIssueRepository issues;
    private InMemoryJobLockRepository locks;
    private DetectionOrchestrator detection;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        signals = new InMemorySignalRepository(clock);
        issues = new InMemoryIssueRepository();

        SignalService signalService = new SignalService(signals, new MapScopeResolver(), NoOpPipelineMetrics.INSTANCE);
        ResolutionService resolution = new ResolutionService(issues, signals, NoOpPipelineMetrics.INSTANCE, clock);
        locks = new InMemoryJobLockRepository();
        detection = mock(DetectionOrchestrator.class);
        PipelineOrchestrator pipeline = new PipelineOrchestrator(
            detection, mock(BalanceService.class), mock(IssueFormationService.class),
            resolution, signalService, new LockedJobRunner(locks, "test-holder"));
        ApiHandlers api = new ApiHandlers(signalService, new IssueService(issues, resolution), pipeline);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new BlockingHandler(Handlers.routing()
                .get("/api/health", api::health)
                .get("/api/signals", api::signals)
                .get("/api/signals/summary", api::signalSummary)
                .get("/api/signals/{id}", api::signal)
                .get("/api/issues", api::issues)
                .get("/api/issues/{id}", api::issue)
                .post("/api/issues/{id}/acknowledge", api::acknowledgeIssue)
                .post("/api/issues/{id}/resolve", api::resolveIssue)
                .post("/api/jobs/detection/{detector}", api::runDetector)
                .post("/api/jobs/{job}", api::runJob)))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    private Issue surfacedIssue() {
        Issue issue = Issue.builder()
            .id(Issue.newId())
            .issueType(IssueType.FINANCIAL)
            .issueSubtype("ar_aging")
            .scope(ScopeLevel.CLIENT, "C1")
            .headline("Acme: AED 20,000 overdue")
            .severity(IssueSeverity.HIGH)
            .priorityScore(150)
            .state(IssueState.SURFACED)
            .detectedAt(NOW)
            .createdAt(NOW)
            .updatedAt(NOW)
            .build();
        issues.insert(issue);
        return issue;
    }

    @Test
    public void testHealth() throws Exception {
        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        assertEquals("ok", json(response).get("status").asText());
    }

    @Test
    public void testSignalsDefaultToActive() throws Exception {
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW));
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW).toBuilder()
            .status(SignalStatus.EXPIRED).build());

        assertEquals(1, json(get("/api/signals")).get("count").asInt());
        assertEquals(2, json(get("/api/signals?status=all")).get("count").asInt());
    }

    @Test
    public void testSignalsRejectsUnknownStatus() throws Exception {
        assertEquals(400, get("/api/signals?status=sleeping").statusCode());
    }

    @Test
    public void testSummaryNeedsLevelAndId() throws Exception {
        assertEquals(400, get("/api/signals/summary?scopeLevel=client").statusCode());

        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW));
        JsonNode summary = json(get("/api/signals/summary?scopeLevel=client&scopeId=C1"));
        assertEquals(1, summary.get("total").asInt());
        assertEquals(-1, summary.get("netCount").asInt());
    }

    @Test
    public void testIssueNotFound() throws Exception {
        assertEquals(404, get("/api/issues/iss_missing").statusCode());
        assertEquals(404, post("/api/issues/iss_missing/acknowledge", "{}").statusCode());
    }

    @Test
    public void testAcknowledgeThenConflict() throws Exception {
        Issue issue = surfacedIssue();

        HttpResponse<String> first = post("/api/issues/" + issue.id() + "/acknowledge", "{\"actor\":\"maya\"}");
        assertEquals(200, first.statusCode());
        JsonNode body = json(first);
        assertTrue(body.get("success").asBoolean());
        assertEquals("ACKNOWLEDGED", body.get("data").get("state").asText());
        assertEquals("maya", body.get("data").get("acknowledgedBy").asText());

        assertEquals(409, post("/api/issues/" + issue.id() + "/acknowledge", "{}").statusCode());
    }

    @Test
    public void testResolveStartsMonitoring() throws Exception {
        Issue issue = surfacedIssue();

        HttpResponse<String> response = post("/api/issues/" + issue.id() + "/resolve",
            "{\"actor\":\"maya\",\"notes\":\"Paid in full\"}");

        assertEquals(200, response.statusCode());
        assertEquals(IssueState.MONITORING, issues.require(issue.id()).state());
        assertEquals("Paid in full", issues.require(issue.id()).resolutionNotes());
    }

    @Test
    public void testInvalidJsonBody() throws Exception {
        Issue issue = surfacedIssue();

        assertEquals(400, post("/api/issues/" + issue.id() + "/acknowledge", "{not json").statusCode());
        assertEquals(IssueState.SURFACED, issues.require(issue.id()).state());
    }

    @Test
    public void testIssuesListedByPriority() throws Exception {
        Issue lower = surfacedIssue();
        Issue higher = lower.toBuilder().id(Issue.newId()).priorityScore(200).build();
        issues.insert(higher);

        JsonNode body = json(get("/api/issues?state=surfaced"));

        assertEquals(2, body.get("count").asInt());
        assertEquals(higher.id(), body.get("data").get(0).get("id").asText());
    }

    @Test
    public void testRunJob() throws Exception {
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW.minus(Duration.ofDays(100)))
            .toBuilder().expiresAt(NOW.minus(Duration.ofDays(1))).build());

        HttpResponse<String> response = post("/api/jobs/expiry", "");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("expiry", body.get("job").asText());
        assertEquals(1, body.get("data").get("expired").asInt());
        assertEquals(404, post("/api/jobs/reboot", "").statusCode());
    }

    @Test
    public void testResolveWithMethod() throws Exception {
        Issue issue = surfacedIssue();

        HttpResponse<String> response = post("/api/issues/" + issue.id() + "/resolve",
            "{\"actor\":\"maya\",\"method\":\"tasks_completed\"}");

        assertEquals(200, response.statusCode());
        assertEquals(ResolutionMethod.TASKS_COMPLETED, issues.require(issue.id()).resolutionMethod());
        assertEquals("TASKS_COMPLETED", json(response).get("data").get("resolutionMethod").asText());
    }

    @Test
    public void testResolveDefaultsToManual() throws Exception {
        Issue issue = surfacedIssue();

        assertEquals(200, post("/api/issues/" + issue.id() + "/resolve", "{}").statusCode());
        assertEquals(ResolutionMethod.MANUAL, issues.require(issue.id()).resolutionMethod());
    }

    @Test
    public void testResolveRejectsUnknownOrDismissedMethod() throws Exception {
        Issue issue = surfacedIssue();

        assertEquals(400, post("/api/issues/" + issue.id() + "/resolve", "{\"method\":\"teleported\"}").statusCode());
        assertEquals(400, post("/api/issues/" + issue.id() + "/resolve", "{\"method\":\"dismissed\"}").statusCode());
        assertEquals(IssueState.SURFACED, issues.require(issue.id()).state());
    }

    @Test
    public void testRunSingleDetector() throws Exception {
        when(detection.runDetector("task_detector"))
            .thenReturn(new DetectionReport(1, 0, 3, 2, 1, List.of(), Map.of()));

        HttpResponse<String> response = post("/api/jobs/detection/task_detector", "");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("detection", body.get("job").asText());
        assertEquals("task_detector", body.get("detector").asText());
        assertEquals(2, body.get("data").get("signalsStored").asInt());
        assertFalse(locks.isHeld("detection"));
    }

    @Test
    public void testRunUnknownDetector() throws Exception {
        when(detection.runDetector("nope")).thenThrow(new IllegalArgumentException("Unknown detector: nope"));

        HttpResponse<String> response = post("/api/jobs/detection/nope", "");

        assertEquals(404, response.statusCode());
        assertEquals("Unknown detector: nope", json(response).get("error").asText());
        assertFalse(locks.isHeld("detection"));
    }

    @Test
    public void testRunDetectorRefusedWhileDetectionRuns() throws Exception {
        locks.tryAcquire("detection", "other-host");

        HttpResponse<String> response = post("/api/jobs/detection/task_detector", "");

        assertEquals(200, response.statusCode());
        assertTrue(json(response).get("data").get("errors").get(0).get("message").asText()
            .startsWith(LockedJobRunner.LOCK_REFUSED));
        verify(detection, never()).runDetector(anyString());
    }
}
