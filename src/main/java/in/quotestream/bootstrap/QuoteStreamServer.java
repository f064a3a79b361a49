package in.quotestream.bootstrap;

import in.quotestream.config.QuoteStreamConfig;
import in.quotestream.infrastructure.metrics.PrometheusMetricsHandler;
import in.quotestream.security.OriginPolicy;
import in.quotestream.service.feed.DistributionEngine;
import in.quotestream.transport.http.HealthHandler;
import in.quotestream.transport.ws.FeedSocketEndpoint;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undertow front end: {@code /ws}, {@code /health}, {@code /metrics}.
 */
public final class QuoteStreamServer {
    private static final Logger log = LoggerFactory.getLogger(QuoteStreamServer.class);

    private static final HttpString ALLOW_ORIGIN = HttpString.tryFromString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_METHODS = HttpString.tryFromString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = HttpString.tryFromString("Access-Control-Allow-Headers");
    private static final HttpString MAX_AGE = HttpString.tryFromString("Access-Control-Max-Age");

    private final QuoteStreamConfig config;
    private final DistributionEngine engine;
    private final CollectorRegistry metricsRegistry;
    private Undertow server;

    public QuoteStreamServer(QuoteStreamConfig config, DistributionEngine engine, CollectorRegistry metricsRegistry) {
        this.config = config;
        this.engine = engine;
        this.metricsRegistry = metricsRegistry;
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        OriginPolicy originPolicy = new OriginPolicy(config.allowedOrigins());
        FeedSocketEndpoint endpoint = new FeedSocketEndpoint(engine.connections(), originPolicy);

        RoutingHandler routes = Handlers.routing()
            .get("/health", new HealthHandler(engine::status))
            .get("/metrics", new PrometheusMetricsHandler(metricsRegistry))
            .get("/ws", endpoint.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "QuoteStream\n\n" +
                    "WS:     ws://localhost:" + config.port() + "/ws\n" +
                    "HTTP:   GET /health, /metrics\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            String allowOrigin = originPolicy.allowOriginHeader(exchange.getRequestHeaders().getFirst(Headers.ORIGIN));
            if (allowOrigin != null) {
                exchange.getResponseHeaders()
                    .put(ALLOW_ORIGIN, allowOrigin)
                    .put(ALLOW_METHODS, "GET, OPTIONS")
                    .put(ALLOW_HEADERS, "Content-Type")
                    .put(MAX_AGE, "3600");
            }

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        server = Undertow.builder()
            .addHttpListener(config.port(), config.bindHost())
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("[HTTP] QuoteStream listening on {}:{} (ws: /ws, health: /health, metrics: /metrics)",
            config.bindHost(), config.port());
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop();
        server = null;
        log.info("[HTTP] Server stopped");
    }
}
