package in.quotestream.service.feed;

import in.quotestream.domain.feed.FeedKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Many-to-many relation between connections and feed keys.
 *
 * Two indexes are kept as exact inverses:
 * - key -> connection ids (drives fan-out and poll start/stop)
 * - connection id -> keys (drives disconnect cleanup)
 *
 * Locking:
 * - every change to one key's subscriber set runs inside that key's atomic
 *   {@link ConcurrentHashMap#compute}, so start/stop decisions for a key are serialized
 * - every change to one connection's key set runs under that connection's entry monitor
 * - lock order is always connection entry, then key
 */
public final class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConcurrentHashMap<FeedKey, Set<String>> subscribersByKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConnectionKeys> keysByConnection = new ConcurrentHashMap<>();
    private final PollControl pollControl;

    public SubscriptionRegistry(PollControl pollControl) {
        this.pollControl = pollControl;
    }

    /**
     * Make a connection known to the registry. Must precede any subscribe.
     *
     * @return false if the id was already registered
     */
    public boolean register(String connectionId) {
        return keysByConnection.putIfAbsent(connectionId, new ConnectionKeys()) == null;
    }

    /**
     * Subscribe a connection to a key. Re-subscribing is a no-op.
     *
     * @return true if the subscription was added, false if it already existed
     * @throws IllegalStateException if the connection is unknown or already dropped
     */
    public boolean subscribe(String connectionId, FeedKey key) {
        ConnectionKeys entry = requireEntry(connectionId);
        synchronized (entry) {
            if (entry.dropped) {
                throw new IllegalStateException("Connection already dropped: " + connectionId);
            }
            if (entry.keys.contains(key)) {
                return false;
            }
            subscribersByKey.compute(key, (k, subscribers) -> {
                Set<String> target = subscribers;
                if (target == null) {
                    pollControl.start(k);
                    target = ConcurrentHashMap.newKeySet();
                    log.info("[REGISTRY] First subscriber for {} ({})", k, connectionId);
                }
                target.add(connectionId);
                return target;
            });
            entry.keys.add(key);
            return true;
        }
    }

    /**
     * Remove a subscription. No-op if it does not exist.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String connectionId, FeedKey key) {
        ConnectionKeys entry = keysByConnection.get(connectionId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (!entry.keys.remove(key)) {
                return false;
            }
            detach(connectionId, key);
            return true;
        }
    }

    /**
     * Remove a connection and every subscription it holds, stopping polls whose
     * last subscriber was this connection. Safe to call more than once; only
     * the first call has an effect.
     *
     * @return keys the connection held, empty if it was unknown or already dropped
     */
    public Set<FeedKey> dropConnection(String connectionId) {
        ConnectionKeys entry = keysByConnection.remove(connectionId);
        if (entry == null) {
            return Set.of();
        }
        synchronized (entry) {
            entry.dropped = true;
            Set<FeedKey> held = Set.copyOf(entry.keys);
            for (FeedKey key : held) {
                detach(connectionId, key);
            }
            entry.keys.clear();
            log.debug("[REGISTRY] Dropped {} ({} subscriptions released)", connectionId, held.size());
            return held;
        }
    }

    private void detach(String connectionId, FeedKey key) {
        subscribersByKey.computeIfPresent(key, (k, subscribers) -> {
            subscribers.remove(connectionId);
            if (subscribers.isEmpty()) {
                pollControl.stop(k);
                log.info("[REGISTRY] Last subscriber left {} ({})", k, connectionId);
                return null;
            }
            return subscribers;
        });
    }

    /**
     * Subscribers of a key at the time of the call.
     */
    public Set<String> subscribersOf(FeedKey key) {
        Set<String> subscribers = subscribersByKey.get(key);
        return subscribers == null ? Set.of() : Set.copyOf(subscribers);
    }

    public Set<FeedKey> keysOf(String connectionId) {
        ConnectionKeys entry = keysByConnection.get(connectionId);
        if (entry == null) {
            return Set.of();
        }
        synchronized (entry) {
            return Set.copyOf(entry.keys);
        }
    }

    public boolean isRegistered(String connectionId) {
        return keysByConnection.containsKey(connectionId);
    }

    public int connectionCount() {
        return keysByConnection.size();
    }

    /**
     * Number of keys with at least one subscriber.
     */
    public int activeKeyCount() {
        return subscribersByKey.size();
    }

    public Set<FeedKey> activeKeys() {
        return Set.copyOf(subscribersByKey.keySet());
    }

    /**
     * Copy of the key index, for consistency checks.
     */
    Map<FeedKey, Set<String>> subscriberIndex() {
        Map<FeedKey, Set<String>> copy = new HashMap<>();
        subscribersByKey.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        return copy;
    }

    /**
     * Copy of the connection index, for consistency checks.
     */
    Map<String, Set<FeedKey>> connectionIndex() {
        Map<String, Set<FeedKey>> copy = new HashMap<>();
        keysByConnection.forEach((id, entry) -> {
            synchronized (entry) {
                copy.put(id, Set.copyOf(entry.keys));
            }
        });
        return copy;
    }

    private ConnectionKeys requireEntry(String connectionId) {
        ConnectionKeys entry = keysByConnection.get(connectionId);
        if (entry == null) {
            throw new IllegalStateException("Unknown connection: " + connectionId);
        }
        return entry;
    }

    private static final class ConnectionKeys {
        final Set<FeedKey> keys = new HashSet<>();
        boolean dropped;
    }
}
