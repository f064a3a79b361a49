package in.quotestream.domain.feed;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Last successfully fetched payload for a feed.
 */
public record FeedSnapshot(FeedKey key, JsonNode payload, Instant fetchedAt) {
    public FeedSnapshot {
        if (key == null || payload == null || fetchedAt == null) {
            throw new IllegalArgumentException("key, payload and fetchedAt cannot be null");
        }
    }
}
