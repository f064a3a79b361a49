package in.quotestream.service.connection;

import in.quotestream.domain.feed.FeedKey;
import in.quotestream.infrastructure.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * One client connection: identity, held keys and a bounded outbound queue.
 *
 * Delivery:
 * - at most one frame is in flight on the sink; the next is sent when it completes
 * - at most {@code capacity} market updates wait in the queue; when full the
 *   oldest waiting update is dropped for the newest
 * - control frames bypass the capacity limit and are never dropped
 * - updates for keys this connection does not hold are ignored
 * - an update is queued only if its timestamp is after the last update queued
 *   for that key. One fetch carries one timestamp, so a cached replay and the
 *   live publish of the same fetch reach the client once.
 *
 * The monitor guards queue state only; nothing that takes other locks is
 * called while holding it.
 */
public final class ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandle.class);

    private final String id;
    private final MessageSink sink;
    private final int capacity;
    private final FeedMetrics metrics;
    private final BiConsumer<ConnectionHandle, Throwable> sendFailureHandler;
    private final Instant connectedAt;
    private volatile Instant lastActivity;

    // Guarded by this
    private final ArrayDeque<OutboundMessage> queue = new ArrayDeque<>();
    private final Map<FeedKey, Instant> heldKeys = new HashMap<>();
    private int queuedUpdates;
    private boolean sending;
    private boolean closed;
    private long droppedUpdates;

    public ConnectionHandle(String id, MessageSink sink, int capacity, FeedMetrics metrics,
                            BiConsumer<ConnectionHandle, Throwable> sendFailureHandler) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.id = id;
        this.sink = sink;
        this.capacity = capacity;
        this.metrics = metrics;
        this.sendFailureHandler = sendFailureHandler;
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String getId() {
        return id;
    }

    public String getRemoteAddress() {
        return sink.remoteAddress();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    /**
     * Ping the peer; an answer counts as activity.
     */
    void ping() {
        synchronized (this) {
            if (closed) {
                return;
            }
        }
        CompletableFuture<Void> answered;
        try {
            answered = sink.ping();
        } catch (RuntimeException e) {
            answered = CompletableFuture.failedFuture(e);
        }
        answered.whenComplete((v, error) -> {
            if (error == null) {
                touch();
            } else {
                log.debug("[WS] Ping to {} failed: {}", id, error.toString());
            }
        });
    }

    /**
     * Start accepting updates for a key.
     */
    public synchronized void hold(FeedKey key) {
        heldKeys.putIfAbsent(key, Instant.MIN);
    }

    /**
     * Stop accepting updates for a key and drop any still queued for it.
     */
    public synchronized void release(FeedKey key) {
        heldKeys.remove(key);
        queue.removeIf(m -> {
            if (key.equals(m.key())) {
                queuedUpdates--;
                return true;
            }
            return false;
        });
    }

    public synchronized boolean holds(FeedKey key) {
        return heldKeys.containsKey(key);
    }

    public void sendControl(String text) {
        offer(OutboundMessage.control(text));
    }

    /**
     * Queue a live market update.
     *
     * @return true if queued
     */
    public boolean sendUpdate(FeedKey key, Instant timestamp, String text) {
        return offer(OutboundMessage.update(key, timestamp, text));
    }

    /**
     * Queue a cached snapshot; skipped if an update at least as recent was already queued.
     */
    public boolean sendReplay(FeedKey key, Instant timestamp, String text) {
        return offer(OutboundMessage.update(key, timestamp, text));
    }

    private boolean offer(OutboundMessage message) {
        OutboundMessage first;
        synchronized (this) {
            if (closed) {
                return false;
            }
            if (message.droppable()) {
                Instant last = heldKeys.get(message.key());
                if (last == null) {
                    return false;
                }
                if (!message.timestamp().isAfter(last)) {
                    return false;
                }
                if (queuedUpdates >= capacity) {
                    dropOldestUpdate();
                }
                heldKeys.put(message.key(), message.timestamp());
                queuedUpdates++;
            }
            queue.addLast(message);
            if (sending) {
                return true;
            }
            sending = true;
            first = next();
        }
        drain(first);
        return true;
    }

    private void dropOldestUpdate() {
        Iterator<OutboundMessage> it = queue.iterator();
        while (it.hasNext()) {
            OutboundMessage m = it.next();
            if (m.droppable()) {
                it.remove();
                queuedUpdates--;
                droppedUpdates++;
                metrics.recordDroppedUpdate();
                log.debug("[WS] Outbound queue full for {}, dropped update for {}", id, m.key());
                return;
            }
        }
    }

    /**
     * Send frames until the queue is empty or a send completes asynchronously.
     */
    private void drain(OutboundMessage first) {
        OutboundMessage current = first;
        while (current != null) {
            CompletableFuture<Void> result;
            try {
                result = sink.send(current.text());
            } catch (RuntimeException e) {
                result = CompletableFuture.failedFuture(e);
            }

            if (!result.isDone()) {
                result.whenComplete((v, error) -> {
                    if (onSent(error)) {
                        OutboundMessage following;
                        synchronized (this) {
                            following = next();
                        }
                        drain(following);
                    }
                });
                return;
            }

            Throwable error = null;
            if (result.isCompletedExceptionally()) {
                error = result.handle((v, e) -> e).join();
            }
            if (!onSent(error)) {
                return;
            }
            synchronized (this) {
                current = next();
            }
        }
    }

    /**
     * @return true if delivery should continue
     */
    private boolean onSent(Throwable error) {
        if (error == null) {
            return true;
        }
        synchronized (this) {
            sending = false;
            queue.clear();
            queuedUpdates = 0;
        }
        log.debug("[WS] Send failed for {}: {}", id, error.toString());
        sendFailureHandler.accept(this, error);
        return false;
    }

    // Caller holds the monitor
    private OutboundMessage next() {
        OutboundMessage m = closed ? null : queue.pollFirst();
        if (m == null) {
            sending = false;
            return null;
        }
        if (m.droppable()) {
            queuedUpdates--;
        }
        return m;
    }

    /**
     * Stop delivery and close the transport. Queued frames are discarded.
     *
     * @return false if already closed
     */
    boolean close() {
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            queue.clear();
            queuedUpdates = 0;
            heldKeys.clear();
        }
        sink.close();
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int queuedUpdates() {
        return queuedUpdates;
    }

    public synchronized long droppedUpdates() {
        return droppedUpdates;
    }
}
