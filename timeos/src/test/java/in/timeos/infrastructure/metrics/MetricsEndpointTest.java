package in.timeos.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusPipelineMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        // fresh registry per test
        metrics = new PrometheusPipelineMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
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

    private HttpResponse<String> scrape() throws Exception {
        return scrape("", null);
    }

    private HttpResponse<String> scrape(String query, String accept) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET();
        if (accept != null) {
            request.header("Accept", accept);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be text/plain for Prometheus format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsContainExpectedMetrics() throws Exception {
        String body = scrape().body();

        assertTrue(body.contains("timeos_signals_detected_total"));
        assertTrue(body.contains("timeos_detector_failures_total"));
        assertTrue(body.contains("timeos_issues_formed_total"));
        assertTrue(body.contains("timeos_issue_transitions_total"));
        assertTrue(body.contains("timeos_regressions_total"));
        assertTrue(body.contains("timeos_sweep_duration_seconds"));
        assertTrue(body.contains("timeos_sweep_errors_total"));
        assertTrue(body.contains("# HELP"));
        assertTrue(body.contains("# TYPE"));
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordSignalsDetected("task_detector", 4);
        metrics.recordSignalsDetected("task_detector", 0);
        metrics.recordDetectorFailure("gmail_detector");
        metrics.recordIssueFormed("CREATED");
        metrics.recordTransition("SURFACED");
        metrics.recordRegression();
        metrics.recordSweep("formation", Duration.ofMillis(250), 2);

        String body = scrape().body();

        assertTrue(body.contains("timeos_signals_detected_total{detector=\"task_detector\",} 4.0"),
            "Should show stored signals per detector");
        assertTrue(body.contains("detector=\"gmail_detector\""), "Should show detector failures");
        assertTrue(body.contains("outcome=\"CREATED\""), "Should show formation outcomes");
        assertTrue(body.contains("state=\"SURFACED\""), "Should show transitions");
        assertTrue(body.contains("timeos_regressions_total 1.0"), "Should show regressions");
        assertTrue(body.contains("timeos_sweep_duration_seconds_count{job=\"formation\",} 1.0"),
            "Should show sweep observations");
        assertTrue(body.contains("timeos_sweep_errors_total{job=\"formation\",} 2.0"), "Should show sweep errors");
    }

    @Test
    public void testCleanSweepRecordsNoErrors() throws Exception {
        metrics.recordSweep("balance", Duration.ofMillis(10), 0);

        String body = scrape().body();

        assertTrue(body.contains("timeos_sweep_duration_seconds_count{job=\"balance\",} 1.0"));
        assertFalse(body.contains("timeos_sweep_errors_total{job=\"balance\""));
    }

    @Test
    public void testOpenMetricsWhenRequested() throws Exception {
        metrics.recordRegression();

        HttpResponse<String> response = scrape("", "application/openmetrics-text; version=1.0.0");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/openmetrics-text"));
        assertTrue(response.body().contains("timeos_regressions_total 1.0"));
        assertTrue(response.body().trim().endsWith("# EOF"), "OpenMetrics output ends with # EOF");
    }

    @Test
    public void testNameFilterRestrictsOutput() throws Exception {
        metrics.recordRegression();
        metrics.recordSweep("formation", Duration.ofMillis(250), 1);

        String body = scrape("?name%5B%5D=timeos_regressions_total", null).body();

        assertTrue(body.contains("timeos_regressions_total 1.0"));
        assertFalse(body.contains("timeos_sweep_duration_seconds"));
        assertFalse(body.contains("timeos_sweep_errors_total"));
    }
}
