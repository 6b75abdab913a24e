package in.timeos.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.ResolutionMethod;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalCategory;
import in.timeos.domain.signal.SignalStatus;
import in.timeos.repository.IssueQuery;
import in.timeos.repository.SignalQuery;
import in.timeos.repository.StorageUnavailableException;
import in.timeos.service.core.Job;
import in.timeos.service.core.PipelineOrchestrator;
import in.timeos.service.detection.DetectionReport;
import in.timeos.service.issue.IssueService;
import in.timeos.service.signal.SignalService;
import in.timeos.service.signal.SignalSummary;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP API handlers for signals, issues and background jobs.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";

    // JSON Response Keys
    private static final String JSON_SUCCESS = "success";
    private static final String JSON_DATA = "data";
    private static final String JSON_ERROR = "error";

    private final SignalService signalService;
    private final IssueService issueService;
    private final PipelineOrchestrator pipeline;

    public ApiHandlers(SignalService signalService, IssueService issueService, PipelineOrchestrator pipeline) {
        this.signalService = signalService;
        this.issueService = issueService;
        this.pipeline = pipeline;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        sendJson(exchange, 200, health);
    }

    // ============================================================
    // SIGNALS
    // ============================================================

    /**
     * GET /api/signals?status=&valence=&category=&type=&scopeLevel=&scopeId=&entityType=&entityId=&days=&limit=&offset=
     */
    public void signals(HttpServerExchange exchange) {
        try {
            Map<String, Deque<String>> params = exchange.getQueryParameters();
            String status = param(params, "status");
            String valence = param(params, "valence");
            String category = param(params, "category");
            String scopeLevel = param(params, "scopeLevel");
            String days = param(params, "days");

            SignalQuery query = new SignalQuery(
                status == null ? SignalStatus.ACTIVE
                    : "all".equalsIgnoreCase(status) ? null : SignalStatus.valueOf(status.toUpperCase()),
                valence == null ? null : Integer.valueOf(valence),
                category == null ? null : SignalCategory.valueOf(category.toUpperCase()),
                param(params, "type"),
                scopeLevel == null ? null : ScopeLevel.fromString(scopeLevel),
                param(params, "scopeId"),
                param(params, "entityType"),
                param(params, "entityId"),
                days == null ? null : Integer.valueOf(days),
                intParam(params, "limit", SignalQuery.DEFAULT_LIMIT),
                intParam(params, "offset", 0));

            List<Signal> signals = signalService.list(query);
            ArrayNode signalsArray = MAPPER.createArrayNode();
            for (Signal s : signals) {
                signalsArray.add(MAPPER.valueToTree(s));
            }

            ObjectNode response = MAPPER.createObjectNode();
            response.put("count", signals.size());
            response.set(JSON_DATA, signalsArray);
            sendJson(exchange, 200, response);
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
        } catch (Exception e) {
            log.error("Error fetching signals: {}", e.getMessage(), e);
            failure(exchange, e, "Failed to fetch signals");
        }
    }

    /**
     * GET /api/signals/{id}
     */
    public void signal(HttpServerExchange exchange) {
        String signalId = pathParam(exchange, "id");
        try {
            Optional<Signal> signal = signalService.get(signalId);
            if (signal.isEmpty()) {
                notFound(exchange, "Signal not found: " + signalId);
                return;
            }
            sendJson(exchange, 200, MAPPER.valueToTree(signal.get()));
        } catch (Exception e) {
            log.error("Error fetching signal {}: {}", signalId, e.getMessage(), e);
            failure(exchange, e, "Failed to fetch signal");
        }
    }

    /**
     * GET /api/signals/summary?scopeLevel=client&scopeId=C1&days=30
     */
    public void signalSummary(HttpServerExchange exchange) {
        try {
            Map<String, Deque<String>> params = exchange.getQueryParameters();
            String scopeLevel = param(params, "scopeLevel");
            String scopeId = param(params, "scopeId");
            if ((scopeLevel == null) != (scopeId == null)) {
                badRequest(exchange, "scopeLevel and scopeId must be given together");
                return;
            }
            int days = intParam(params, "days", SignalService.DEFAULT_SUMMARY_DAYS);

            SignalSummary summary = signalService.summary(
                scopeLevel == null ? null : ScopeLevel.fromString(scopeLevel), scopeId, days);

            ObjectNode response = MAPPER.valueToTree(summary);
            response.put("total", summary.total());
            response.put("netCount", summary.netCount());
            sendJson(exchange, 200, response);
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
        } catch (Exception e) {
            log.error("Error building signal summary: {}", e.getMessage(), e);
            failure(exchange, e, "Failed to build signal summary");
        }
    }

    // ============================================================
    // ISSUES
    // ============================================================

    /**
     * GET /api/issues?state=&scopeType=&scopeId=&subtype=&limit=&offset=
     */
    public void issues(HttpServerExchange exchange) {
        try {
            Map<String, Deque<String>> params = exchange.getQueryParameters();
            String state = param(params, "state");
            String scopeType = param(params, "scopeType");

            IssueQuery query = new IssueQuery(
                state == null ? null : IssueState.valueOf(state.toUpperCase()),
                scopeType == null ? null : ScopeLevel.fromString(scopeType),
                param(params, "scopeId"),
                param(params, "subtype"),
                intParam(params, "limit", IssueQuery.DEFAULT_LIMIT),
                intParam(params, "offset", 0));

            List<Issue> issues = issueService.list(query);
            ArrayNode issuesArray = MAPPER.createArrayNode();
            for (Issue issue : issues) {
                issuesArray.add(MAPPER.valueToTree(issue));
            }

            ObjectNode response = MAPPER.createObjectNode();
            response.put("count", issues.size());
            response.set(JSON_DATA, issuesArray);
            sendJson(exchange, 200, response);
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
        } catch (Exception e) {
            log.error("Error fetching issues: {}", e.getMessage(), e);
            failure(exchange, e, "Failed to fetch issues");
        }
    }

    /**
     * GET /api/issues/{id}
     */
    public void issue(HttpServerExchange exchange) {
        String issueId = pathParam(exchange, "id");
        try {
            Optional<Issue> issue = issueService.get(issueId);
            if (issue.isEmpty()) {
                notFound(exchange, "Issue not found: " + issueId);
                return;
            }
            sendJson(exchange, 200, MAPPER.valueToTree(issue.get()));
        } catch (Exception e) {
            log.error("Error fetching issue {}: {}", issueId, e.getMessage(), e);
            failure(exchange, e, "Failed to fetch issue");
        }
    }

    /**
     * POST /api/issues/{id}/acknowledge  body: {"actor": "..."}
     */
    public void acknowledgeIssue(HttpServerExchange exchange) {
        transition(exchange, "acknowledge", (issueId, body) ->
            issueService.acknowledge(issueId, text(body, "actor")));
    }

    /**
     * POST /api/issues/{id}/address  body: {"actor": "..."}
     */
    public void addressIssue(HttpServerExchange exchange) {
        transition(exchange, "address", (issueId, body) ->
            issueService.startAddressing(issueId, text(body, "actor")));
    }

    /**
     * POST /api/issues/{id}/resolve  body: {"actor": "...", "notes": "...", "method": "TASKS_COMPLETED"}
     *
     * method is optional and defaults to MANUAL.
     */
    public void resolveIssue(HttpServerExchange exchange) {
        transition(exchange, "resolve", (issueId, body) -> {
            String method = text(body, "method");
            return issueService.resolve(issueId,
                method == null ? null : ResolutionMethod.valueOf(method.trim().toUpperCase()),
                text(body, "actor"), text(body, "notes"));
        });
    }

    /**
     * POST /api/issues/{id}/dismiss  body: {"actor": "...", "reason": "..."}
     */
    public void dismissIssue(HttpServerExchange exchange) {
        transition(exchange, "dismiss", (issueId, body) ->
            issueService.dismiss(issueId, text(body, "actor"), text(body, "reason")));
    }

    @FunctionalInterface
    private interface Transition {
        boolean apply(String issueId, JsonNode body);
    }

    private void transition(HttpServerExchange exchange, String action, Transition transition) {
        String issueId = pathParam(exchange, "id");

        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = body == null || body.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(body);

                if (issueService.get(issueId).isEmpty()) {
                    notFound(ex, "Issue not found: " + issueId);
                    return;
                }
                if (!transition.apply(issueId, json)) {
                    sendError(ex, 409, "Cannot " + action + " issue " + issueId + " in its current state");
                    return;
                }

                ObjectNode response = MAPPER.createObjectNode();
                response.put(JSON_SUCCESS, true);
                issueService.get(issueId).ifPresent(issue -> response.set(JSON_DATA, MAPPER.valueToTree(issue)));
                sendJson(ex, 200, response);
            } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                badRequest(ex, "Invalid JSON body");
            } catch (IllegalArgumentException e) {
                badRequest(ex, e.getMessage());
            } catch (Exception e) {
                log.error("Error on {} for issue {}: {}", action, issueId, e.getMessage(), e);
                failure(ex, e, "Failed to " + action + " issue");
            }
        }, StandardCharsets.UTF_8);
    }

    // ============================================================
    // JOBS
    // ============================================================

    /**
     * POST /api/jobs/{job} - run one background job now and return its report.
     */
    public void runJob(HttpServerExchange exchange) {
        String key = pathParam(exchange, "job");
        Optional<Job> job = Job.fromKey(key);
        if (job.isEmpty()) {
            notFound(exchange, "Unknown job: " + key);
            return;
        }

        try {
            log.info("[API] Running job {} on request", job.get().key());
            Object report = pipeline.run(job.get());

            ObjectNode response = MAPPER.createObjectNode();
            response.put("job", job.get().key());
            response.set(JSON_DATA, MAPPER.valueToTree(report));
            sendJson(exchange, 200, response);
        } catch (Exception e) {
            log.error("Error running job {}: {}", key, e.getMessage(), e);
            failure(exchange, e, "Failed to run job " + key);
        }
    }

    /**
     * POST /api/jobs/detection/{detector} - run one detector now.
     */
    public void runDetector(HttpServerExchange exchange) {
        String detectorId = pathParam(exchange, "detector");
        try {
            log.info("[API] Running detector {} on request", detectorId);
            DetectionReport report = pipeline.runDetector(detectorId);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("job", Job.DETECTION.key());
            response.put("detector", detectorId);
            response.set(JSON_DATA, MAPPER.valueToTree(report));
            sendJson(exchange, 200, response);
        } catch (IllegalArgumentException e) {
            notFound(exchange, e.getMessage());
        } catch (Exception e) {
            log.error("Error running detector {}: {}", detectorId, e.getMessage(), e);
            failure(exchange, e, "Failed to run detector " + detectorId);
        }
    }

    // ============================================================

    private static String param(Map<String, Deque<String>> params, String name) {
        Deque<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.getFirst();
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intParam(Map<String, Deque<String>> params, String name, int defaultValue) {
        String value = param(params, name);
        return value == null ? defaultValue : Integer.parseInt(value);
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put(JSON_ERROR, message);
        sendJson(exchange, status, error);
    }

    private void badRequest(HttpServerExchange exchange, String message) {
        sendError(exchange, 400, message);
    }

    private void notFound(HttpServerExchange exchange, String message) {
        sendError(exchange, 404, message);
    }

    private void failure(HttpServerExchange exchange, Exception e, String message) {
        if (e instanceof StorageUnavailableException) {
            sendError(exchange, 503, "Storage unavailable");
        } else {
            sendError(exchange, 500, message);
        }
    }
}
