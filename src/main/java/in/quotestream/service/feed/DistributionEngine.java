package in.quotestream.service.feed;

import in.quotestream.config.QuoteStreamConfig;
import in.quotestream.domain.feed.AssetClass;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.infrastructure.cache.SnapshotCache;
import in.quotestream.infrastructure.metrics.FeedMetrics;
import in.quotestream.infrastructure.provider.FeedFetcherRegistry;
import in.quotestream.service.connection.ConnectionHandle;
import in.quotestream.service.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Owner of the market-data distribution pipeline.
 *
 * <pre>
 * connection -> ConnectionManager -> SubscriptionRegistry -> PollingScheduler
 *            -> FeedFetcher -> SnapshotCache + BroadcastRouter -> subscriber queues
 * </pre>
 *
 * Every instance is self-contained: no static state, so several engines can
 * live side by side in one JVM (tests do this).
 */
public final class DistributionEngine {
    private static final Logger log = LoggerFactory.getLogger(DistributionEngine.class);

    private final SnapshotCache cache;
    private final BroadcastRouter router;
    private final PollingScheduler scheduler;
    private final SubscriptionRegistry registry;
    private final ConnectionManager connectionManager;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public DistributionEngine(QuoteStreamConfig config, FeedFetcherRegistry fetchers,
                              SnapshotCache cache, FeedMetrics metrics) {
        this(config, fetchers, cache, metrics, AssetClass::pollInterval, Clock.systemUTC());
    }

    /**
     * @param intervalPolicy poll interval per asset class; production uses {@link AssetClass#pollInterval()}
     */
    public DistributionEngine(QuoteStreamConfig config, FeedFetcherRegistry fetchers,
                              SnapshotCache cache, FeedMetrics metrics,
                              Function<AssetClass, Duration> intervalPolicy, Clock clock) {
        this.cache = cache;
        this.clock = clock;
        this.router = new BroadcastRouter(this::subscribersOf, this::findConnection, metrics);
        this.scheduler = new PollingScheduler(fetchers, cache, router, metrics,
            config.fetchThreads(), intervalPolicy, clock);
        this.registry = new SubscriptionRegistry(scheduler);
        this.connectionManager = new ConnectionManager(registry, cache, metrics,
            config.outboundBufferSize(), config.replayCachedOnSubscribe(),
            config.idleTimeout(), config.idleSweepInterval());
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        connectionManager.start();
        log.info("[ENGINE] Distribution engine started");
    }

    /**
     * Close all connections, cancel all poll tasks, close the cache. Idempotent.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("[ENGINE] Shutting down ({} connections, {} poll tasks)",
            connectionManager.getConnectionCount(), scheduler.activeTaskCount());
        connectionManager.shutdown();
        scheduler.shutdown();
        try {
            cache.close();
        } catch (RuntimeException e) {
            log.warn("[ENGINE] Cache close failed: {}", e.getMessage());
        }
        log.info("[ENGINE] Distribution engine stopped");
    }

    public EngineStatus status() {
        return new EngineStatus(
            connectionManager.getConnectionCount(),
            scheduler.activeTaskCount(),
            registry.activeKeyCount(),
            Instant.now(clock));
    }

    public ConnectionManager connections() {
        return connectionManager;
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    public PollingScheduler scheduler() {
        return scheduler;
    }

    private Set<String> subscribersOf(FeedKey key) {
        return registry.subscribersOf(key);
    }

    private ConnectionHandle findConnection(String connectionId) {
        return connectionManager.find(connectionId);
    }
}
