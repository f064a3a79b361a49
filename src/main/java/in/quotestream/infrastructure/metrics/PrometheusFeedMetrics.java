package in.quotestream.infrastructure.metrics;

import in.quotestream.domain.feed.AssetClass;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of FeedMetrics.
 *
 * Key Metrics:
 * - feed_fetches_total{asset_class, outcome} - Upstream fetch results
 * - feed_fetch_latency_seconds{asset_class} - Upstream fetch latency
 * - feed_ticks_skipped_total{asset_class} - Ticks skipped while a fetch was in flight
 * - feed_cache_write_failures_total{asset_class}
 * - feed_updates_published_total{asset_class} - Updates enqueued to connections
 * - feed_updates_dropped_total - Updates dropped from full outbound queues
 * - feed_connection_events_total{event}
 * - feed_active_connections, feed_active_poll_tasks
 */
public class PrometheusFeedMetrics implements FeedMetrics {

    private final CollectorRegistry registry;

    private final Counter fetchCounter;
    private final Histogram fetchLatency;
    private final Counter tickSkippedCounter;
    private final Counter cacheWriteFailureCounter;
    private final Counter publishedCounter;
    private final Counter droppedCounter;
    private final Counter connectionEventCounter;
    private final Gauge activeConnections;
    private final Gauge activePollTasks;

    public PrometheusFeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusFeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.fetchCounter = Counter.build()
            .name("feed_fetches_total")
            .help("Total number of upstream fetches by outcome")
            .labelNames("asset_class", "outcome")
            .register(registry);

        this.fetchLatency = Histogram.build()
            .name("feed_fetch_latency_seconds")
            .help("Upstream fetch latency in seconds")
            .labelNames("asset_class")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.tickSkippedCounter = Counter.build()
            .name("feed_ticks_skipped_total")
            .help("Ticks skipped because the previous fetch was still in flight")
            .labelNames("asset_class")
            .register(registry);

        this.cacheWriteFailureCounter = Counter.build()
            .name("feed_cache_write_failures_total")
            .help("Snapshot cache write failures")
            .labelNames("asset_class")
            .register(registry);

        this.publishedCounter = Counter.build()
            .name("feed_updates_published_total")
            .help("Market updates enqueued to subscriber connections")
            .labelNames("asset_class")
            .register(registry);

        this.droppedCounter = Counter.build()
            .name("feed_updates_dropped_total")
            .help("Market updates dropped from full outbound queues")
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("feed_connection_events_total")
            .help("Client connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.activeConnections = Gauge.build()
            .name("feed_active_connections")
            .help("Currently open client connections")
            .register(registry);

        this.activePollTasks = Gauge.build()
            .name("feed_active_poll_tasks")
            .help("Currently running poll tasks")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordFetch(AssetClass assetClass, FetchOutcome outcome, Duration latency) {
        fetchCounter.labels(assetClass.name(), outcome.name()).inc();
        fetchLatency.labels(assetClass.name()).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordTickSkipped(AssetClass assetClass) {
        tickSkippedCounter.labels(assetClass.name()).inc();
    }

    @Override
    public void recordCacheWriteFailure(AssetClass assetClass) {
        cacheWriteFailureCounter.labels(assetClass.name()).inc();
    }

    @Override
    public void recordPublished(AssetClass assetClass, int recipients) {
        if (recipients > 0) {
            publishedCounter.labels(assetClass.name()).inc(recipients);
        }
    }

    @Override
    public void recordDroppedUpdate() {
        droppedCounter.inc();
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
        connectionEventCounter.labels(event.name()).inc();
    }

    @Override
    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    @Override
    public void setActivePollTasks(int count) {
        activePollTasks.set(count);
    }
}
