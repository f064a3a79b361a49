package in.quotestream.bootstrap;

import in.quotestream.config.QuoteStreamConfig;
import in.quotestream.infrastructure.cache.InMemorySnapshotCache;
import in.quotestream.infrastructure.metrics.PrometheusFeedMetrics;
import in.quotestream.infrastructure.provider.AlphaVantageForexFetcher;
import in.quotestream.infrastructure.provider.AlphaVantageStockFetcher;
import in.quotestream.infrastructure.provider.CoinGeckoFetcher;
import in.quotestream.infrastructure.provider.FeedFetcherRegistry;
import in.quotestream.service.feed.DistributionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * QuoteStream entry point.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== QuoteStream Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        QuoteStreamConfig config = QuoteStreamConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Upstream providers
        // ═══════════════════════════════════════════════════════════════
        FeedFetcherRegistry fetchers = createFetchers(config);

        StartupConfigValidator.validate(config, fetchers);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusFeedMetrics metrics = new PrometheusFeedMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Distribution engine
        // ═══════════════════════════════════════════════════════════════
        DistributionEngine engine = new DistributionEngine(config, fetchers, new InMemorySnapshotCache(), metrics);
        engine.start();

        QuoteStreamServer server = new QuoteStreamServer(config, engine, metrics.getRegistry());
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Signal received, shutting down...");
            server.stop();
            engine.shutdown();
            log.info("[SHUTDOWN] QuoteStream stopped");
        }, "quotestream-shutdown"));

        log.info("✓ QuoteStream started on http://localhost:{}/ (ws://localhost:{}/ws)", config.port(), config.port());
    }

    static FeedFetcherRegistry createFetchers(QuoteStreamConfig config) {
        FeedFetcherRegistry fetchers = new FeedFetcherRegistry()
            .register(new CoinGeckoFetcher(config.coinGeckoBaseUrl(), config.upstreamTimeout()));
        if (config.hasAlphaVantageKey()) {
            fetchers
                .register(new AlphaVantageStockFetcher(
                    config.alphaVantageBaseUrl(), config.alphaVantageKey(), config.upstreamTimeout()))
                .register(new AlphaVantageForexFetcher(
                    config.alphaVantageBaseUrl(), config.alphaVantageKey(), config.upstreamTimeout()));
        }
        return fetchers;
    }

    private App() {
    }
}
