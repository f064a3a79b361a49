package in.quotestream.infrastructure.cache;

import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.FeedSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * Write-through store for the last good snapshot per feed.
 *
 * Writes are last-writer-wins per key; callers need no extra locking.
 */
public interface SnapshotCache extends AutoCloseable {

    /**
     * Store a snapshot that expires after {@code ttl}.
     *
     * @throws CacheWriteException if the store rejected the write
     */
    void setWithTtl(FeedKey key, FeedSnapshot snapshot, Duration ttl) throws CacheWriteException;

    /**
     * Latest unexpired snapshot, if any.
     */
    Optional<FeedSnapshot> get(FeedKey key);

    /**
     * Release the store connection. Writes after close fail with {@link CacheWriteException}.
     */
    @Override
    void close();
}
