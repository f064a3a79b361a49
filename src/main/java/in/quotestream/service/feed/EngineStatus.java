package in.quotestream.service.feed;

import java.time.Instant;

/**
 * Point-in-time view for health checks.
 *
 * @param connections     open client connections
 * @param activePollTasks running poll tasks
 * @param subscribedFeeds feed keys with at least one subscriber
 */
public record EngineStatus(int connections, int activePollTasks, int subscribedFeeds, Instant timestamp) {
}
