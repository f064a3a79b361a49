package in.quotestream.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics
 *
 * Text format 0.0.4 by default, OpenMetrics when the scraper asks for it in
 * {@code Accept}. {@code ?name[]=feed_active_connections&name[]=...} limits the
 * output to the named series.
 *
 * <pre>
 * # HELP feed_fetches_total Total number of upstream fetches by outcome
 * # TYPE feed_fetches_total counter
 * feed_fetches_total{asset_class="STOCK",outcome="SUCCESS",} 1234.0
 * feed_fetches_total{asset_class="STOCK",outcome="UPSTREAM_ERROR",} 12.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(
            exchange.getRequestHeaders().getFirst(Headers.ACCEPT));

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, registry.filteredMetricFamilySamples(requestedNames(exchange)));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        String body = writer.toString();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
        log.debug("[METRICS] Served {} bytes ({})", body.length(), contentType);
    }

    /**
     * Empty set means every series.
     */
    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        return names == null ? Set.of() : new HashSet<>(names);
    }
}
