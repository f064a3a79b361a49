package in.quotestream.service.feed;

import in.quotestream.domain.feed.FeedKey;

/**
 * Start/stop hook the registry drives when a key gains its first subscriber
 * or loses its last one. Calls for one key arrive serialized.
 */
public interface PollControl {

    /**
     * @return true if a new task was started, false if one was already running
     */
    boolean start(FeedKey key);

    /**
     * @return true if a running task was stopped
     */
    boolean stop(FeedKey key);
}
