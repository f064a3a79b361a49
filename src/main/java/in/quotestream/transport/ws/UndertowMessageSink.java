package in.quotestream.transport.ws;

import in.quotestream.service.connection.MessageSink;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link MessageSink} over an Undertow WebSocket channel. Sends are
 * non-blocking; completion is reported through the returned future.
 *
 * At most one ping is outstanding; the endpoint reports pong frames through
 * {@link #pongReceived()}.
 */
final class UndertowMessageSink implements MessageSink {
    private static final Logger log = LoggerFactory.getLogger(UndertowMessageSink.class);

    private static final byte[] PING_PAYLOAD = "quotestream".getBytes(StandardCharsets.US_ASCII);

    private final WebSocketChannel channel;
    private final AtomicReference<CompletableFuture<Void>> awaitingPong = new AtomicReference<>();

    UndertowMessageSink(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public CompletableFuture<Void> send(String text) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (!channel.isOpen()) {
            result.completeExceptionally(new ClosedChannelException());
            return result;
        }
        WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                result.complete(null);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                result.completeExceptionally(throwable);
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> ping() {
        if (!channel.isOpen()) {
            return CompletableFuture.failedFuture(new ClosedChannelException());
        }
        CompletableFuture<Void> outstanding = awaitingPong.get();
        if (outstanding != null && !outstanding.isDone()) {
            return outstanding;
        }
        CompletableFuture<Void> answered = new CompletableFuture<>();
        awaitingPong.set(answered);
        WebSockets.sendPing(ByteBuffer.wrap(PING_PAYLOAD), channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                // Answered by the pong, not by the write
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                answered.completeExceptionally(throwable);
            }
        });
        return answered;
    }

    void pongReceived() {
        CompletableFuture<Void> outstanding = awaitingPong.get();
        if (outstanding != null) {
            outstanding.complete(null);
        }
    }

    @Override
    public void close() {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            return;
        }
        try {
            channel.sendClose();
        } catch (IOException e) {
            log.debug("[WS] Close frame to {} failed: {}", remoteAddress(), e.getMessage());
        }
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}
