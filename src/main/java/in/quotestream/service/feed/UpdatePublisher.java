package in.quotestream.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.FeedKey;

import java.time.Instant;

/**
 * Receives successful fetch results. Must not block the caller.
 */
@FunctionalInterface
public interface UpdatePublisher {

    void publish(FeedKey key, JsonNode payload, Instant fetchedAt);
}
