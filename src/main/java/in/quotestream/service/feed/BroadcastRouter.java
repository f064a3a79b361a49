package in.quotestream.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.MarketUpdate;
import in.quotestream.infrastructure.metrics.FeedMetrics;
import in.quotestream.service.connection.ConnectionDirectory;
import in.quotestream.service.connection.ConnectionHandle;
import in.quotestream.service.connection.FeedProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Set;
import java.util.function.Function;

/**
 * Fans a fetch result out to the connections subscribed to its key.
 *
 * Subscribers are read at publish time. The frame is rendered once and queued
 * on each connection independently; a full or broken connection never delays
 * the others. Nothing is retried.
 */
public final class BroadcastRouter implements UpdatePublisher {
    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final Function<FeedKey, Set<String>> subscriberLookup;
    private final ConnectionDirectory connections;
    private final FeedMetrics metrics;

    public BroadcastRouter(Function<FeedKey, Set<String>> subscriberLookup,
                           ConnectionDirectory connections, FeedMetrics metrics) {
        this.subscriberLookup = subscriberLookup;
        this.connections = connections;
        this.metrics = metrics;
    }

    @Override
    public void publish(FeedKey key, JsonNode payload, Instant fetchedAt) {
        Set<String> subscribers = subscriberLookup.apply(key);
        if (subscribers.isEmpty()) {
            log.debug("[ROUTER] No subscribers for {}, update dropped", key);
            return;
        }

        String frame = FeedProtocol.marketUpdate(new MarketUpdate(key, payload, fetchedAt));
        int queued = 0;
        for (String connectionId : subscribers) {
            ConnectionHandle handle = connections.find(connectionId);
            if (handle == null) {
                continue;
            }
            try {
                if (handle.sendUpdate(key, fetchedAt, frame)) {
                    queued++;
                }
            } catch (RuntimeException e) {
                log.warn("[ROUTER] Failed to queue {} for {}", key, connectionId, e);
            }
        }

        metrics.recordPublished(key.assetClass(), queued);
        log.debug("[ROUTER] {} queued for {}/{} subscribers", key, queued, subscribers.size());
    }
}
