package in.quotestream.service.connection;

import in.quotestream.domain.feed.FeedKey;

import java.time.Instant;

/**
 * Pre-rendered frame waiting in a connection's outbound queue.
 *
 * Only market updates ({@code key != null}) may be dropped under backpressure;
 * control frames (acks, pongs, errors) are always delivered.
 */
public record OutboundMessage(String text, FeedKey key, Instant timestamp) {

    public static OutboundMessage control(String text) {
        return new OutboundMessage(text, null, null);
    }

    public static OutboundMessage update(FeedKey key, Instant timestamp, String text) {
        return new OutboundMessage(text, key, timestamp);
    }

    public boolean droppable() {
        return key != null;
    }
}
