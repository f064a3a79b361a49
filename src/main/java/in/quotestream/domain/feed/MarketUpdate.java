package in.quotestream.domain.feed;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One fetch result addressed to subscribers of a feed.
 *
 * @param timestamp fetch completion time
 */
public record MarketUpdate(FeedKey key, JsonNode data, Instant timestamp) {

    public static MarketUpdate fromSnapshot(FeedSnapshot snapshot) {
        return new MarketUpdate(snapshot.key(), snapshot.payload(), snapshot.fetchedAt());
    }
}
