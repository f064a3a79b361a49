package in.quotestream.infrastructure.cache;

import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.FeedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process TTL cache for feed snapshots.
 *
 * Expired entries are evicted lazily on read and by a periodic purge, so keys
 * whose feeds went quiet do not accumulate.
 */
public final class InMemorySnapshotCache implements SnapshotCache {
    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotCache.class);

    private final ConcurrentHashMap<FeedKey, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService purger;
    private volatile boolean closed = false;

    public InMemorySnapshotCache() {
        this(Clock.systemUTC(), Duration.ofMinutes(1));
    }

    public InMemorySnapshotCache(Clock clock, Duration purgeInterval) {
        this.clock = clock;
        this.purger = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-cache-purge");
            t.setDaemon(true);
            return t;
        });
        long periodMs = purgeInterval.toMillis();
        purger.scheduleAtFixedRate(this::purgeExpired, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void setWithTtl(FeedKey key, FeedSnapshot snapshot, Duration ttl) throws CacheWriteException {
        if (closed) {
            throw new CacheWriteException("Cache closed, dropping write for " + key);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new CacheWriteException("Non-positive TTL " + ttl + " for " + key);
        }
        store.put(key, new Entry(snapshot, clock.instant().plus(ttl)));
        log.debug("[CACHE] market_data:{} stored (ttl={}s)", key, ttl.toSeconds());
    }

    @Override
    public Optional<FeedSnapshot> get(FeedKey key) {
        Entry entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.snapshot());
    }

    /**
     * Number of stored entries, expired ones included until purged.
     */
    public int size() {
        return store.size();
    }

    void purgeExpired() {
        Instant now = clock.instant();
        int before = store.size();
        store.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int purged = before - store.size();
        if (purged > 0) {
            log.debug("[CACHE] Purged {} expired snapshots", purged);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        purger.shutdownNow();
        store.clear();
        log.info("[CACHE] Snapshot cache closed");
    }

    private record Entry(FeedSnapshot snapshot, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
