package in.timeos.infrastructure.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics for the pipeline registry.
 *
 * The format follows the Accept header: OpenMetrics when the scraper asks for it,
 * Prometheus text 0.0.4 otherwise. Repeated {@code name[]} parameters restrict the
 * output to those sample names, e.g. {@code /metrics?name[]=timeos_regressions_total}.
 *
 * Example output:
 * <pre>
 * # HELP timeos_issues_formed_total Issue formation outcomes
 * # TYPE timeos_issues_formed_total counter
 * timeos_issues_formed_total{outcome="CREATED"} 3.0
 * timeos_issues_formed_total{outcome="UNCHANGED"} 12.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        try {
            Enumeration<Collector.MetricFamilySamples> samples = names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names);

            StringWriter writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer, samples);
            String body = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            exchange.getResponseSender().send(body);

            log.debug("[METRICS] Scrape served: {} bytes, format={}, filter={}",
                body.length(), contentType.substring(0, contentType.indexOf(';')), names.isEmpty() ? "none" : names);
        } catch (IOException e) {
            log.error("[METRICS] Failed to write pipeline metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    names.add(value.trim());
                }
            }
        }
        return names;
    }
}
