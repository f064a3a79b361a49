package in.quotestream.infrastructure.metrics;

import in.quotestream.domain.feed.AssetClass;

import java.time.Duration;

/**
 * Metrics sink for the distribution engine.
 *
 * Implementations can publish to Prometheus or anything else; {@link #NOOP}
 * is used where no monitoring is wired (unit tests).
 */
public interface FeedMetrics {

    /**
     * Record a completed upstream fetch.
     *
     * @param assetClass Class of the polled feed
     * @param outcome    Fetch outcome
     * @param latency    Time spent in the fetcher
     */
    void recordFetch(AssetClass assetClass, FetchOutcome outcome, Duration latency);

    /**
     * Record a tick skipped because the previous fetch for the key was still running.
     */
    void recordTickSkipped(AssetClass assetClass);

    void recordCacheWriteFailure(AssetClass assetClass);

    /**
     * Record updates delivered to connection queues by one publish.
     */
    void recordPublished(AssetClass assetClass, int recipients);

    /**
     * Record an update dropped from a full outbound queue.
     */
    void recordDroppedUpdate();

    void recordConnectionEvent(ConnectionEvent event);

    void setActiveConnections(int count);

    void setActivePollTasks(int count);

    enum FetchOutcome {
        SUCCESS,
        UPSTREAM_ERROR,
        DISCARDED       // completed after the task was stopped
    }

    enum ConnectionEvent {
        CONNECTED,
        DISCONNECTED,
        IDLE_TIMEOUT,
        ERROR
    }

    FeedMetrics NOOP = new FeedMetrics() {
        @Override public void recordFetch(AssetClass assetClass, FetchOutcome outcome, Duration latency) {}
        @Override public void recordTickSkipped(AssetClass assetClass) {}
        @Override public void recordCacheWriteFailure(AssetClass assetClass) {}
        @Override public void recordPublished(AssetClass assetClass, int recipients) {}
        @Override public void recordDroppedUpdate() {}
        @Override public void recordConnectionEvent(ConnectionEvent event) {}
        @Override public void setActiveConnections(int count) {}
        @Override public void setActivePollTasks(int count) {}
    };
}
