package in.quotestream.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.AssetClass;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.FeedSnapshot;
import in.quotestream.infrastructure.cache.CacheWriteException;
import in.quotestream.infrastructure.cache.SnapshotCache;
import in.quotestream.infrastructure.metrics.FeedMetrics;
import in.quotestream.infrastructure.metrics.FeedMetrics.FetchOutcome;
import in.quotestream.infrastructure.provider.FeedFetcher;
import in.quotestream.infrastructure.provider.FeedFetcherRegistry;
import in.quotestream.infrastructure.provider.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * One recurring poll task per subscribed feed key.
 *
 * Threads:
 * - a single timer thread only fires ticks and never performs I/O
 * - fetches run on a fixed pool; a key has at most one fetch in flight, a tick
 *   that finds the previous fetch still running is skipped
 *
 * Lifecycle per key: STOPPED -> RUNNING -> STOPPED. {@link #stop} cancels the
 * task's {@link ScheduledFuture}; a fetch already in flight completes but its
 * result is discarded. Publishing happens under the task's monitor and only
 * while the task is still the live task for its key, so once {@code stop}
 * returns that task can no longer deliver anything.
 *
 * Upstream failures skip the tick: the cached snapshot is left alone and the
 * next tick fires on schedule (no retry, no backoff).
 */
public final class PollingScheduler implements PollControl {
    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    private final ConcurrentHashMap<FeedKey, PollTask> tasks = new ConcurrentHashMap<>();

    private final FeedFetcherRegistry fetchers;
    private final SnapshotCache cache;
    private final UpdatePublisher publisher;
    private final FeedMetrics metrics;
    private final Function<AssetClass, Duration> intervalPolicy;
    private final Clock clock;

    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService fetchPool;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public PollingScheduler(FeedFetcherRegistry fetchers, SnapshotCache cache, UpdatePublisher publisher,
                            FeedMetrics metrics, int fetchThreads) {
        this(fetchers, cache, publisher, metrics, fetchThreads, AssetClass::pollInterval, Clock.systemUTC());
    }

    public PollingScheduler(FeedFetcherRegistry fetchers, SnapshotCache cache, UpdatePublisher publisher,
                            FeedMetrics metrics, int fetchThreads,
                            Function<AssetClass, Duration> intervalPolicy, Clock clock) {
        this.fetchers = fetchers;
        this.cache = cache;
        this.publisher = publisher;
        this.metrics = metrics;
        this.intervalPolicy = intervalPolicy;
        this.clock = clock;

        this.timer = new ScheduledThreadPoolExecutor(1, daemonThreads("feed-poll-timer"));
        this.timer.setRemoveOnCancelPolicy(true);
        this.fetchPool = new ThreadPoolExecutor(fetchThreads, fetchThreads,
            60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), daemonThreads("feed-fetch"));
    }

    /**
     * Start polling a key. The first tick fires immediately.
     */
    @Override
    public boolean start(FeedKey key) {
        if (shutdown.get()) {
            log.warn("[SCHEDULER] Ignoring start for {} after shutdown", key);
            return false;
        }

        Duration interval = intervalPolicy.apply(key.assetClass());
        PollTask task = new PollTask(key, interval);
        if (tasks.putIfAbsent(key, task) != null) {
            return false;
        }

        if (fetchers.find(key.assetClass()).isEmpty()) {
            log.warn("[SCHEDULER] No provider configured for {}; ticks for {} will be skipped",
                key.assetClass(), key);
        }

        try {
            task.future = timer.scheduleAtFixedRate(task, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            tasks.remove(key, task);
            log.warn("[SCHEDULER] Timer rejected task for {}", key);
            return false;
        }

        metrics.setActivePollTasks(tasks.size());
        log.info("[SCHEDULER] Started polling {} every {}ms", key, interval.toMillis());
        return true;
    }

    @Override
    public boolean stop(FeedKey key) {
        PollTask task = tasks.remove(key);
        if (task == null) {
            return false;
        }
        task.cancel();
        metrics.setActivePollTasks(tasks.size());
        log.info("[SCHEDULER] Stopped polling {}", key);
        return true;
    }

    public boolean isRunning(FeedKey key) {
        return tasks.containsKey(key);
    }

    public int activeTaskCount() {
        return tasks.size();
    }

    public Set<FeedKey> runningKeys() {
        return Set.copyOf(tasks.keySet());
    }

    /**
     * Cancel every task and stop both pools. In-flight fetches are interrupted.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<FeedKey> keys = List.copyOf(tasks.keySet());
        for (FeedKey key : keys) {
            stop(key);
        }
        timer.shutdownNow();
        fetchPool.shutdownNow();
        try {
            if (!fetchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[SCHEDULER] Fetch pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[SCHEDULER] Shut down ({} tasks cancelled)", keys.size());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Recurring fetch-and-publish activity for one key.
     */
    private final class PollTask implements Runnable {
        private final FeedKey key;
        private final Duration interval;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        PollTask(FeedKey key, Duration interval) {
            this.key = key;
            this.interval = interval;
        }

        /**
         * Timer tick: hand the fetch to the pool and return immediately.
         */
        @Override
        public void run() {
            if (tasks.get(key) != this) {
                // Superseded without being cancelled; make sure it stops ticking
                cancel();
                return;
            }
            if (!inFlight.compareAndSet(false, true)) {
                metrics.recordTickSkipped(key.assetClass());
                log.debug("[SCHEDULER] Previous fetch for {} still running, skipping tick", key);
                return;
            }
            try {
                fetchPool.execute(this::fetchAndPublish);
            } catch (RejectedExecutionException e) {
                inFlight.set(false);
                log.debug("[SCHEDULER] Fetch pool rejected tick for {}", key);
            }
        }

        private void fetchAndPublish() {
            long startNanos = System.nanoTime();
            try {
                Optional<JsonNode> payload = fetch(startNanos);
                if (payload.isPresent()) {
                    deliver(payload.get(), elapsedSince(startNanos));
                }
            } finally {
                inFlight.set(false);
            }
        }

        private Optional<JsonNode> fetch(long startNanos) {
            Optional<FeedFetcher> fetcher = fetchers.find(key.assetClass());
            try {
                if (fetcher.isEmpty()) {
                    throw new UpstreamException(key.assetClass(), key.symbol(), "No provider configured");
                }
                JsonNode payload = fetcher.get().fetch(key.symbol());
                if (payload == null) {
                    throw new UpstreamException(key.assetClass(), key.symbol(), "Provider returned no data");
                }
                return Optional.of(payload);
            } catch (UpstreamException e) {
                metrics.recordFetch(key.assetClass(), FetchOutcome.UPSTREAM_ERROR, elapsedSince(startNanos));
                if (fetcher.isPresent()) {
                    log.warn("[SCHEDULER] Fetch failed for {}: {}", key, e.getMessage());
                } else {
                    log.debug("[SCHEDULER] Skipping tick for {}: {}", key, e.getMessage());
                }
                return Optional.empty();
            } catch (RuntimeException e) {
                metrics.recordFetch(key.assetClass(), FetchOutcome.UPSTREAM_ERROR, elapsedSince(startNanos));
                log.warn("[SCHEDULER] Fetcher threw unexpectedly for {}", key, e);
                return Optional.empty();
            }
        }

        private void deliver(JsonNode payload, Duration latency) {
            if (!isLive()) {
                metrics.recordFetch(key.assetClass(), FetchOutcome.DISCARDED, latency);
                log.debug("[SCHEDULER] Discarding result for stopped task {}", key);
                return;
            }

            Instant fetchedAt = clock.instant();
            metrics.recordFetch(key.assetClass(), FetchOutcome.SUCCESS, latency);

            try {
                cache.setWithTtl(key, new FeedSnapshot(key, payload, fetchedAt), interval.multipliedBy(2));
            } catch (CacheWriteException | RuntimeException e) {
                metrics.recordCacheWriteFailure(key.assetClass());
                log.warn("[SCHEDULER] Cache write failed for {}: {}", key, e.getMessage());
            }

            synchronized (this) {
                if (!isLive()) {
                    log.debug("[SCHEDULER] Task for {} stopped during cache write, not publishing", key);
                    return;
                }
                try {
                    publisher.publish(key, payload, fetchedAt);
                } catch (RuntimeException e) {
                    log.error("[SCHEDULER] Publish failed for {}", key, e);
                }
            }
        }

        private boolean isLive() {
            ScheduledFuture<?> f = future;
            return tasks.get(key) == this && (f == null || !f.isCancelled());
        }

        /**
         * Waits for an in-progress publish of this task to finish.
         */
        void cancel() {
            synchronized (this) {
                ScheduledFuture<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
            }
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
