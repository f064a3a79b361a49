package in.quotestream.infrastructure.metrics;

import in.quotestream.domain.feed.AssetClass;
import in.quotestream.infrastructure.metrics.FeedMetrics.ConnectionEvent;
import in.quotestream.infrastructure.metrics.FeedMetrics.FetchOutcome;
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
 * Integration test for Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Metrics recording and export
 * - name[] filtering and OpenMetrics negotiation
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private CollectorRegistry registry;
    private PrometheusFeedMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        // Fresh registry per test so counters start at zero
        registry = new CollectorRegistry();
        metrics = new PrometheusFeedMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            )
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

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");
        assertTrue(response.body().contains("# HELP"), "Metrics should contain HELP declarations");
        assertTrue(response.body().contains("# TYPE"), "Metrics should contain TYPE declarations");
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordFetch(AssetClass.STOCK, FetchOutcome.SUCCESS, Duration.ofMillis(120));
        metrics.recordFetch(AssetClass.STOCK, FetchOutcome.SUCCESS, Duration.ofMillis(80));
        metrics.recordFetch(AssetClass.CRYPTO, FetchOutcome.UPSTREAM_ERROR, Duration.ofMillis(300));
        metrics.recordTickSkipped(AssetClass.CRYPTO);
        metrics.recordPublished(AssetClass.STOCK, 3);
        metrics.recordDroppedUpdate();
        metrics.recordConnectionEvent(ConnectionEvent.CONNECTED);
        metrics.setActiveConnections(2);
        metrics.setActivePollTasks(1);

        String body = scrape().body();

        assertTrue(body.contains("feed_fetches_total{asset_class=\"STOCK\",outcome=\"SUCCESS\",} 2.0"),
            "Should show successful STOCK fetches");
        assertTrue(body.contains("outcome=\"UPSTREAM_ERROR\""), "Should show failed fetches");
        assertTrue(body.contains("feed_fetch_latency_seconds_count{asset_class=\"STOCK\",} 2.0"),
            "Should show latency observations");
        assertTrue(body.contains("feed_updates_published_total{asset_class=\"STOCK\",} 3.0"));
        assertTrue(body.contains("feed_active_connections 2.0"));
        assertTrue(body.contains("feed_active_poll_tasks 1.0"));
    }

    @Test
    public void testSampleValues() {
        metrics.recordCacheWriteFailure(AssetClass.FOREX);
        metrics.recordDroppedUpdate();
        metrics.recordDroppedUpdate();
        metrics.recordPublished(AssetClass.ETF, 0);

        assertEquals(1.0, registry.getSampleValue("feed_cache_write_failures_total",
            new String[]{"asset_class"}, new String[]{"FOREX"}));
        assertEquals(2.0, registry.getSampleValue("feed_updates_dropped_total"));
        assertNull(registry.getSampleValue("feed_updates_published_total",
            new String[]{"asset_class"}, new String[]{"ETF"}), "Zero recipients records nothing");
    }

    @Test
    public void testNameFilterLimitsOutput() throws Exception {
        metrics.setActiveConnections(4);
        metrics.setActivePollTasks(2);

        String body = scrape("?name%5B%5D=feed_active_connections", null).body();

        assertTrue(body.contains("feed_active_connections 4.0"));
        assertFalse(body.contains("feed_active_poll_tasks"), "Unrequested series should be filtered out");
    }

    @Test
    public void testOpenMetricsNegotiation() throws Exception {
        HttpResponse<String> response = scrape("", "application/openmetrics-text; version=1.0.0");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/openmetrics-text"));
        assertTrue(response.body().trim().endsWith("# EOF"), "OpenMetrics output ends with # EOF");
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("", null);
    }

    private HttpResponse<String> scrape(String query, String accept) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET();
        if (accept != null) {
            builder.header("Accept", accept);
        }
        HttpRequest request = builder.build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
