package in.quotestream.service.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.FeedSnapshot;
import in.quotestream.domain.feed.InvalidFeedKeyException;
import in.quotestream.domain.feed.MarketUpdate;
import in.quotestream.infrastructure.cache.SnapshotCache;
import in.quotestream.infrastructure.metrics.FeedMetrics;
import in.quotestream.infrastructure.metrics.FeedMetrics.ConnectionEvent;
import in.quotestream.security.InputValidator;
import in.quotestream.service.feed.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Connection lifecycle: open, client requests, close.
 *
 * {@link #close} is the single exit path for every connection, whatever noticed
 * the disconnect (close frame, channel close, I/O error, send failure, idle
 * timeout, shutdown). Removal from the connection map is the atomic step that
 * decides which caller performs the cleanup, so
 * {@link SubscriptionRegistry#dropConnection} runs exactly once per connection.
 */
public final class ConnectionManager implements ConnectionDirectory {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final ConcurrentMap<String, ConnectionHandle> connections = new ConcurrentHashMap<>();

    private final SubscriptionRegistry registry;
    private final SnapshotCache cache;
    private final FeedMetrics metrics;
    private final InputValidator validator = new InputValidator();
    private final int outboundBufferSize;
    private final boolean replayCachedOnSubscribe;
    private final Duration idleTimeout;
    private final Duration idleSweepInterval;
    private final Duration pingAfter;

    // Idle sweeps, pings and closes triggered by failed sends
    private final ScheduledExecutorService housekeeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-housekeeper");
        t.setDaemon(true);
        return t;
    });

    public ConnectionManager(SubscriptionRegistry registry, SnapshotCache cache, FeedMetrics metrics,
                             int outboundBufferSize, boolean replayCachedOnSubscribe,
                             Duration idleTimeout, Duration idleSweepInterval) {
        this.registry = registry;
        this.cache = cache;
        this.metrics = metrics;
        this.outboundBufferSize = outboundBufferSize;
        this.replayCachedOnSubscribe = replayCachedOnSubscribe;
        this.idleTimeout = idleTimeout;
        this.idleSweepInterval = idleSweepInterval;
        Duration halfTimeout = idleTimeout.dividedBy(2);
        this.pingAfter = idleSweepInterval.compareTo(halfTimeout) < 0 ? idleSweepInterval : halfTimeout;
    }

    public void start() {
        long periodMs = idleSweepInterval.toMillis();
        housekeeper.scheduleAtFixedRate(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("[WS] Connection manager started (idle timeout {}s, buffer {} updates)",
            idleTimeout.toSeconds(), outboundBufferSize);
    }

    /**
     * Register a new connection and greet it with its id.
     */
    public ConnectionHandle open(MessageSink sink) {
        String id = UUID.randomUUID().toString();
        ConnectionHandle handle = new ConnectionHandle(id, sink, outboundBufferSize, metrics, this::onSendFailure);

        registry.register(id);
        connections.put(id, handle);
        metrics.recordConnectionEvent(ConnectionEvent.CONNECTED);
        metrics.setActiveConnections(connections.size());

        log.info("[WS] Client connected: {} from {} (total: {})", id, sink.remoteAddress(), connections.size());
        handle.sendControl(FeedProtocol.connected(id));
        return handle;
    }

    /**
     * Sends can fail on a publisher thread that holds poll-task locks, so the
     * close runs on the housekeeping thread instead.
     */
    private void onSendFailure(ConnectionHandle handle, Throwable error) {
        String reason = "send failed: " + error.getMessage();
        try {
            housekeeper.execute(() -> close(handle.getId(), ConnectionEvent.ERROR, reason));
        } catch (RejectedExecutionException e) {
            log.debug("[WS] Shutting down, {} will be closed by shutdown ({})", handle.getId(), reason);
        }
    }

    /**
     * Record transport-level inbound traffic (ping or pong frames).
     */
    public void touch(String connectionId) {
        ConnectionHandle handle = connections.get(connectionId);
        if (handle != null) {
            handle.touch();
        }
    }

    @Override
    public ConnectionHandle find(String connectionId) {
        return connections.get(connectionId);
    }

    /**
     * Handle one inbound text frame. Bad input is answered with an error frame,
     * never with a disconnect.
     */
    public void onMessage(String connectionId, String raw) {
        ConnectionHandle handle = connections.get(connectionId);
        if (handle == null) {
            log.debug("[WS] Message for closed connection {} ignored", connectionId);
            return;
        }
        handle.touch();

        ClientRequest request;
        try {
            request = FeedProtocol.parse(raw);
        } catch (JsonProcessingException e) {
            handle.sendControl(FeedProtocol.error("Invalid JSON: " + e.getOriginalMessage()));
            return;
        }
        if (request == null || request.action == null) {
            handle.sendControl(FeedProtocol.error("Missing 'action'"));
            return;
        }

        switch (request.action) {
            case "subscribe" -> withKey(handle, request, key -> subscribe(handle, key));
            case "unsubscribe" -> withKey(handle, request, key -> unsubscribe(handle, key));
            case "ping" -> {
                if (!validator.isValidNonce(request.nonce)) {
                    handle.sendControl(FeedProtocol.error("Invalid nonce"));
                } else {
                    handle.sendControl(FeedProtocol.pong(request.nonce));
                }
            }
            default -> handle.sendControl(FeedProtocol.error("Unknown action: " + request.action));
        }
    }

    private void withKey(ConnectionHandle handle, ClientRequest request, Consumer<FeedKey> action) {
        FeedKey key;
        try {
            key = FeedKey.of(request.assetClass, request.symbol);
        } catch (InvalidFeedKeyException e) {
            log.debug("[WS] Rejected {} from {}: {}", request.action, handle.getId(), e.getMessage());
            handle.sendControl(FeedProtocol.error(e.getMessage()));
            return;
        }
        action.accept(key);
    }

    private void subscribe(ConnectionHandle handle, FeedKey key) {
        handle.hold(key);
        handle.sendControl(FeedProtocol.subscribed(key));

        boolean added;
        try {
            added = registry.subscribe(handle.getId(), key);
        } catch (IllegalStateException e) {
            // Lost the race with close()
            log.debug("[WS] Subscribe on closing connection {}: {}", handle.getId(), e.getMessage());
            return;
        }

        if (!added) {
            log.debug("[WS] {} already subscribed to {}", handle.getId(), key);
            return;
        }
        log.info("[WS] {} subscribed to {}", handle.getId(), key);

        if (replayCachedOnSubscribe) {
            Optional<FeedSnapshot> cached = cache.get(key);
            cached.ifPresent(snapshot -> {
                MarketUpdate update = MarketUpdate.fromSnapshot(snapshot);
                if (handle.sendReplay(key, update.timestamp(), FeedProtocol.marketUpdate(update))) {
                    log.debug("[WS] Replayed cached {} from {} to {}", key, snapshot.fetchedAt(), handle.getId());
                }
            });
        }
    }

    private void unsubscribe(ConnectionHandle handle, FeedKey key) {
        handle.release(key);
        if (registry.unsubscribe(handle.getId(), key)) {
            log.info("[WS] {} unsubscribed from {}", handle.getId(), key);
        }
        handle.sendControl(FeedProtocol.unsubscribed(key));
    }

    /**
     * Close a connection after a normal disconnect. Idempotent.
     *
     * @return true if this call performed the cleanup
     */
    public boolean close(String connectionId, String reason) {
        return close(connectionId, ConnectionEvent.DISCONNECTED, reason);
    }

    /**
     * Close a connection and release all its subscriptions. Idempotent.
     *
     * @param event how the disconnect was detected, for metrics
     * @return true if this call performed the cleanup
     */
    public boolean close(String connectionId, ConnectionEvent event, String reason) {
        ConnectionHandle handle = connections.remove(connectionId);
        if (handle == null) {
            return false;
        }

        try {
            handle.close();
        } finally {
            registry.dropConnection(connectionId);
        }

        metrics.recordConnectionEvent(event);
        metrics.setActiveConnections(connections.size());

        log.info("[WS] Client disconnected: {} ({}) (total: {})", connectionId, reason, connections.size());
        return true;
    }

    /**
     * Close connections past the idle timeout, then ping the ones that have been
     * quiet for a while. A listening client that answers pings is never idle.
     */
    void sweep() {
        closeIdleConnections();
        pingQuietConnections();
    }

    void closeIdleConnections() {
        Instant cutoff = Instant.now().minus(idleTimeout);
        try {
            for (ConnectionHandle handle : List.copyOf(connections.values())) {
                if (handle.getLastActivity().isBefore(cutoff)) {
                    close(handle.getId(), ConnectionEvent.IDLE_TIMEOUT, "idle timeout");
                }
            }
        } catch (RuntimeException e) {
            log.warn("[WS] Idle sweep failed: {}", e.toString());
        }
    }

    void pingQuietConnections() {
        Instant quietSince = Instant.now().minus(pingAfter);
        try {
            for (ConnectionHandle handle : List.copyOf(connections.values())) {
                if (handle.getLastActivity().isBefore(quietSince)) {
                    handle.ping();
                }
            }
        } catch (RuntimeException e) {
            log.warn("[WS] Ping sweep failed: {}", e.toString());
        }
    }

    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Close every connection and stop the housekeeping thread.
     */
    public void shutdown() {
        housekeeper.shutdownNow();
        int closed = 0;
        for (String id : List.copyOf(connections.keySet())) {
            if (close(id, "server shutdown")) {
                closed++;
            }
        }
        log.info("[WS] Connection manager stopped ({} connections closed)", closed);
    }
}
