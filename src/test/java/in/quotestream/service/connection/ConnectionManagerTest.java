package in.quotestream.service.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.quotestream.domain.feed.AssetClass;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.FeedSnapshot;
import in.quotestream.infrastructure.cache.SnapshotCache;
import in.quotestream.infrastructure.metrics.FeedMetrics;
import in.quotestream.service.feed.PollControl;
import in.quotestream.service.feed.SubscriptionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final FeedKey AAPL = FeedKey.of(AssetClass.STOCK, "AAPL");

    @Mock
    private PollControl pollControl;
    @Mock
    private SnapshotCache cache;

    private SubscriptionRegistry registry;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(pollControl);
        manager = newManager(true, Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private ConnectionManager newManager(boolean replay, Duration idleTimeout) {
        return new ConnectionManager(registry, cache, FeedMetrics.NOOP, 16, replay,
            idleTimeout, Duration.ofMinutes(1));
    }

    private ConnectionManager newManager(Duration idleTimeout, Duration sweepInterval) {
        return new ConnectionManager(registry, cache, FeedMetrics.NOOP, 16, true,
            idleTimeout, sweepInterval);
    }

    private static String subscribe(String assetClass, String symbol) {
        return "{\"action\":\"subscribe\",\"assetClass\":\"" + assetClass + "\",\"symbol\":\"" + symbol + "\"}";
    }

    @Test
    @DisplayName("Open greets the client with its connection id")
    void open_greetsWithConnectionId() {
        RecordingSink sink = new RecordingSink();

        ConnectionHandle handle = manager.open(sink);

        JsonNode hello = sink.messages().get(0);
        assertEquals("connected", hello.get("type").asText());
        assertEquals(handle.getId(), hello.get("connectionId").asText());
        assertTrue(registry.isRegistered(handle.getId()));
        assertEquals(1, manager.getConnectionCount());
    }

    @Test
    @DisplayName("Subscribe is acknowledged and starts polling")
    void subscribe_acknowledgesAndStartsPolling() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();

        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        JsonNode ack = sink.messagesOfType(FeedProtocol.SUBSCRIBED).get(0);
        assertEquals("STOCK", ack.get("assetClass").asText());
        assertEquals("AAPL", ack.get("symbol").asText());
        assertEquals(Set.of(AAPL), registry.keysOf(id));
        verify(pollControl).start(AAPL);
    }

    @Test
    @DisplayName("Subscribe accepts assetType as an alias")
    void subscribe_acceptsAssetTypeAlias() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();

        manager.onMessage(id, "{\"action\":\"subscribe\",\"assetType\":\"crypto\",\"symbol\":\"bitcoin\"}");

        assertEquals(Set.of(FeedKey.of(AssetClass.CRYPTO, "bitcoin")), registry.keysOf(id));
    }

    @Test
    @DisplayName("Invalid feed key is answered with an error frame")
    void subscribe_invalidKeyAnsweredWithError() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();

        manager.onMessage(id, subscribe("OPTIONS", "AAPL"));
        manager.onMessage(id, subscribe("STOCK", "AAPL rm"));
        manager.onMessage(id, "{\"action\":\"subscribe\",\"symbol\":\"AAPL\"}");

        List<JsonNode> errors = sink.messagesOfType(FeedProtocol.ERROR);
        assertEquals(3, errors.size());
        assertTrue(errors.get(0).get("message").asText().contains("OPTIONS"));
        assertTrue(registry.keysOf(id).isEmpty());
        assertEquals(1, manager.getConnectionCount(), "Bad input never disconnects");
        verifyNoInteractions(pollControl);
    }

    @Test
    @DisplayName("Malformed frames are answered with an error frame")
    void malformedFrames_answeredWithError() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();

        manager.onMessage(id, "not json");
        manager.onMessage(id, "null");
        manager.onMessage(id, "{\"symbol\":\"AAPL\"}");
        manager.onMessage(id, "{\"action\":\"teleport\"}");

        List<JsonNode> errors = sink.messagesOfType(FeedProtocol.ERROR);
        assertEquals(4, errors.size());
        assertTrue(errors.get(0).get("message").asText().startsWith("Invalid JSON"));
        assertEquals("Missing 'action'", errors.get(1).get("message").asText());
        assertEquals("Missing 'action'", errors.get(2).get("message").asText());
        assertEquals("Unknown action: teleport", errors.get(3).get("message").asText());
        assertEquals(1, manager.getConnectionCount());
    }

    @Test
    @DisplayName("Ping is answered with a pong carrying the nonce")
    void ping_echoesNonce() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();

        manager.onMessage(id, "{\"action\":\"ping\",\"nonce\":\"abc-1\"}");
        manager.onMessage(id, "{\"action\":\"ping\"}");
        manager.onMessage(id, "{\"action\":\"ping\",\"nonce\":\"<script>\"}");

        List<JsonNode> pongs = sink.messagesOfType(FeedProtocol.PONG);
        assertEquals(2, pongs.size());
        assertEquals("abc-1", pongs.get(0).get("nonce").asText());
        assertEquals("", pongs.get(1).get("nonce").asText());
        assertEquals(1, sink.messagesOfType(FeedProtocol.ERROR).size());
    }

    @Test
    @DisplayName("Unsubscribe is acknowledged and stops polling")
    void unsubscribe_acknowledgesAndStopsPolling() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        manager.onMessage(id, "{\"action\":\"unsubscribe\",\"assetClass\":\"STOCK\",\"symbol\":\"AAPL\"}");

        assertEquals(1, sink.messagesOfType(FeedProtocol.UNSUBSCRIBED).size());
        assertTrue(registry.keysOf(id).isEmpty());
        verify(pollControl).stop(AAPL);
    }

    @Test
    @DisplayName("Cached snapshot is replayed right after the ack")
    void subscribe_replaysCachedSnapshotAfterAck() {
        Instant fetchedAt = Instant.parse("2024-05-01T14:30:00Z");
        FeedSnapshot cached = new FeedSnapshot(AAPL, MAPPER.createObjectNode().put("price", 189.5), fetchedAt);
        when(cache.get(AAPL)).thenReturn(Optional.of(cached));

        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        List<String> types = new ArrayList<>();
        sink.messages().forEach(m -> types.add(m.get("type").asText()));
        assertEquals(List.of("connected", "subscribed", "market_update"), types);

        JsonNode replay = sink.messagesOfType(FeedProtocol.MARKET_UPDATE).get(0);
        assertEquals(189.5, replay.get("data").get("price").asDouble());
        assertEquals("2024-05-01T14:30:00Z", replay.get("timestamp").asText());
    }

    @Test
    @DisplayName("Repeated subscribe does not replay again")
    void subscribe_repeatDoesNotReplayAgain() {
        FeedSnapshot cached = new FeedSnapshot(AAPL, MAPPER.createObjectNode(), Instant.now());
        when(cache.get(AAPL)).thenReturn(Optional.of(cached));

        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        assertEquals(2, sink.messagesOfType(FeedProtocol.SUBSCRIBED).size(), "Every request is acknowledged");
        assertEquals(1, sink.messagesOfType(FeedProtocol.MARKET_UPDATE).size());
        verify(cache, times(1)).get(AAPL);
    }

    @Test
    @DisplayName("No replay when replay is disabled")
    void subscribe_noReplayWhenDisabled() {
        manager.shutdown();
        manager = newManager(false, Duration.ofMinutes(5));

        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        assertTrue(sink.messagesOfType(FeedProtocol.MARKET_UPDATE).isEmpty());
        verifyNoInteractions(cache);
    }

    @Test
    @DisplayName("Close cleans up exactly once")
    void close_cleansUpExactlyOnce() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        assertTrue(manager.close(id, "client closed"));
        assertFalse(manager.close(id, "channel closed"));

        verify(pollControl, times(1)).stop(AAPL);
        assertEquals(1, sink.closeCount());
        assertFalse(registry.isRegistered(id));
        assertNull(manager.find(id));
        assertEquals(0, manager.getConnectionCount());
    }

    @Test
    @DisplayName("Concurrent close paths run cleanup once")
    void close_concurrentPathsOnlyOneWins() throws Exception {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String reason = "path-" + i;
            results.add(pool.submit(() -> {
                go.await();
                return manager.close(id, reason);
            }));
        }
        go.countDown();

        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        assertEquals(1, winners);
        verify(pollControl, times(1)).stop(AAPL);
        assertEquals(1, sink.closeCount());
    }

    @Test
    @DisplayName("Failed send closes the connection")
    void sendFailure_closesConnection() throws Exception {
        RecordingSink sink = RecordingSink.manual();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        sink.failNext(new IOException("Connection reset"));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (manager.find(id) != null && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertNull(manager.find(id), "Broken connection is closed");
        verify(pollControl, timeout(1000)).stop(AAPL);
    }

    @Test
    @DisplayName("Idle connections are closed")
    void idleConnections_closed() throws Exception {
        manager.shutdown();
        manager = newManager(true, Duration.ofMillis(50));

        RecordingSink idle = new RecordingSink();
        String idleId = manager.open(idle).getId();
        Thread.sleep(120);
        RecordingSink active = new RecordingSink();
        String activeId = manager.open(active).getId();

        manager.closeIdleConnections();

        assertNull(manager.find(idleId));
        assertNotNull(manager.find(activeId));
        assertEquals(1, idle.closeCount());
    }

    @Test
    @DisplayName("Inbound traffic keeps a connection alive")
    void inboundTrafficKeepsConnectionAlive() throws Exception {
        manager.shutdown();
        manager = newManager(true, Duration.ofMillis(100));

        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        Thread.sleep(70);
        manager.onMessage(id, "{\"action\":\"ping\"}");
        Thread.sleep(70);

        manager.closeIdleConnections();

        assertNotNull(manager.find(id));
    }

    @Test
    @DisplayName("Messages for a closed connection are ignored")
    void messagesForClosedConnectionIgnored() {
        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        manager.close(id, "client closed");

        manager.onMessage(id, subscribe("STOCK", "AAPL"));

        assertEquals(1, sink.frames().size(), "Only the greeting was sent");
        verify(pollControl, never()).start(any());
    }

    @Test
    @DisplayName("Shutdown closes every connection")
    void shutdown_closesEveryConnection() {
        RecordingSink a = new RecordingSink();
        RecordingSink b = new RecordingSink();
        manager.open(a);
        String idB = manager.open(b).getId();
        manager.onMessage(idB, subscribe("STOCK", "AAPL"));

        manager.shutdown();

        assertEquals(0, manager.getConnectionCount());
        assertEquals(1, a.closeCount());
        assertEquals(1, b.closeCount());
        verify(pollControl).stop(AAPL);
        assertEquals(0, registry.connectionCount());
    }

    @Test
    @DisplayName("Quiet connection is pinged and an answer keeps it alive")
    void quietConnectionPingedAndKeptAlive() throws Exception {
        manager.shutdown();
        manager = newManager(Duration.ofMillis(400), Duration.ofMinutes(1));

        RecordingSink sink = new RecordingSink();
        String id = manager.open(sink).getId();
        Thread.sleep(250);

        manager.sweep();
        assertEquals(1, sink.pingCount(), "Quiet for half the idle timeout, so pinged");

        Thread.sleep(200);
        manager.closeIdleConnections();

        assertNotNull(manager.find(id), "Answered ping counts as activity");
        assertEquals(0, sink.closeCount());
    }

    @Test
    @DisplayName("Peer that never answers pings is closed after the idle timeout")
    void silentPeerClosedAfterIdleTimeout() throws Exception {
        manager.shutdown();
        manager = newManager(Duration.ofMillis(400), Duration.ofMinutes(1));

        RecordingSink sink = RecordingSink.silentPeer();
        String id = manager.open(sink).getId();
        manager.onMessage(id, subscribe("STOCK", "AAPL"));
        Thread.sleep(250);

        manager.sweep();
        assertEquals(1, sink.pingCount());
        assertNotNull(manager.find(id), "Not idle yet");

        Thread.sleep(250);
        manager.sweep();

        assertNull(manager.find(id));
        assertEquals(1, sink.closeCount());
        verify(pollControl).stop(AAPL);
    }

    @Test
    @DisplayName("Recently active connections are not pinged")
    void activeConnectionNotPinged() {
        manager.shutdown();
        manager = newManager(Duration.ofMinutes(5), Duration.ofMinutes(1));

        RecordingSink sink = new RecordingSink();
        manager.open(sink);
        manager.sweep();

        assertEquals(0, sink.pingCount());
    }

    @Test
    @DisplayName("Transport ping and pong frames count as activity")
    void transportFramesCountAsActivity() throws Exception {
        manager.shutdown();
        manager = newManager(Duration.ofMillis(100), Duration.ofMinutes(1));

        RecordingSink sink = RecordingSink.silentPeer();
        String id = manager.open(sink).getId();
        Thread.sleep(70);
        manager.touch(id);
        Thread.sleep(70);

        manager.closeIdleConnections();

        assertNotNull(manager.find(id));
        assertDoesNotThrow(() -> manager.touch("unknown-connection"));
    }
}
