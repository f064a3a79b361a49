package in.quotestream.service.connection;

import java.util.concurrent.CompletableFuture;

/**
 * Transport-side outbound channel of one client connection.
 */
public interface MessageSink {

    /**
     * Send one text frame asynchronously.
     *
     * @return future completing when the transport accepted the frame, or
     *         exceptionally if the connection is broken
     */
    CompletableFuture<Void> send(String text);

    /**
     * Send a transport-level ping frame.
     *
     * @return future completing when the peer answers, or exceptionally if the
     *         ping could not be sent
     */
    CompletableFuture<Void> ping();

    /**
     * Close the underlying transport. Must tolerate repeated calls.
     */
    void close();

    /**
     * Peer address for logging.
     */
    String remoteAddress();
}
