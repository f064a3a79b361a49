package in.quotestream.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.quotestream.domain.feed.AssetClass;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.FeedSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySnapshotCacheTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final FeedKey AAPL = FeedKey.of(AssetClass.STOCK, "AAPL");
    private static final FeedKey BTC = FeedKey.of(AssetClass.CRYPTO, "bitcoin");

    private ManualClock clock;
    private InMemorySnapshotCache cache;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-05-01T10:00:00Z"));
        // Purge only when the test asks for it
        cache = new InMemorySnapshotCache(clock, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void testGetReturnsStoredSnapshotUntilExpiry() throws Exception {
        FeedSnapshot snapshot = snapshot(AAPL, 189.5);
        cache.setWithTtl(AAPL, snapshot, Duration.ofSeconds(10));

        assertEquals(Optional.of(snapshot), cache.get(AAPL));

        clock.advance(Duration.ofSeconds(9));
        assertTrue(cache.get(AAPL).isPresent(), "Still fresh one second before expiry");

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(AAPL).isEmpty(), "Expired exactly at TTL");
        assertEquals(0, cache.size(), "Expired entry evicted on read");
    }

    @Test
    void testLastWriterWins() throws Exception {
        cache.setWithTtl(AAPL, snapshot(AAPL, 189.5), Duration.ofSeconds(10));
        FeedSnapshot newer = snapshot(AAPL, 190.25);
        cache.setWithTtl(AAPL, newer, Duration.ofSeconds(10));

        assertEquals(newer, cache.get(AAPL).orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void testPurgeRemovesOnlyExpiredEntries() throws Exception {
        cache.setWithTtl(AAPL, snapshot(AAPL, 189.5), Duration.ofSeconds(10));
        cache.setWithTtl(BTC, snapshot(BTC, 64000), Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(30));
        cache.purgeExpired();

        assertEquals(1, cache.size());
        assertTrue(cache.get(BTC).isPresent());
    }

    @Test
    void testMissingKey() {
        assertTrue(cache.get(AAPL).isEmpty());
    }

    @Test
    void testNonPositiveTtlRejected() {
        assertThrows(CacheWriteException.class,
            () -> cache.setWithTtl(AAPL, snapshot(AAPL, 1), Duration.ZERO));
        assertThrows(CacheWriteException.class,
            () -> cache.setWithTtl(AAPL, snapshot(AAPL, 1), Duration.ofSeconds(-1)));
    }

    @Test
    void testWritesFailAfterClose() throws Exception {
        cache.setWithTtl(AAPL, snapshot(AAPL, 189.5), Duration.ofSeconds(10));
        cache.close();

        assertTrue(cache.get(AAPL).isEmpty(), "Close clears the store");
        assertThrows(CacheWriteException.class,
            () -> cache.setWithTtl(AAPL, snapshot(AAPL, 1), Duration.ofSeconds(10)));
        assertDoesNotThrow(cache::close, "Close is idempotent");
    }

    private FeedSnapshot snapshot(FeedKey key, double price) {
        return new FeedSnapshot(key, MAPPER.createObjectNode().put("price", price), clock.instant());
    }

    static final class ManualClock extends Clock {
        private Instant now;

        ManualClock(Instant start) {
            this.now = start;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
