package in.quotestream.transport.ws;

import in.quotestream.infrastructure.metrics.FeedMetrics.ConnectionEvent;
import in.quotestream.security.OriginPolicy;
import in.quotestream.service.connection.ConnectionHandle;
import in.quotestream.service.connection.ConnectionManager;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Undertow WebSocket endpoint for market-data clients.
 *
 * Each channel maps to one {@link ConnectionHandle}. Every way a channel can
 * end (close frame, channel close, receive error) is routed to
 * {@link ConnectionManager#close}, which tolerates the duplicates. Ping and
 * pong frames count as activity for the idle sweep.
 */
public final class FeedSocketEndpoint {
    private static final Logger log = LoggerFactory.getLogger(FeedSocketEndpoint.class);

    private final ConnectionManager connections;
    private final OriginPolicy originPolicy;

    public FeedSocketEndpoint(ConnectionManager connections, OriginPolicy originPolicy) {
        this.connections = connections;
        this.originPolicy = originPolicy;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String origin = exchange.getRequestHeader("Origin");
                if (!originPolicy.isAllowed(origin)) {
                    log.warn("[WS] Connection rejected: origin {} not allowed ({})", origin, channel.getSourceAddress());
                    try {
                        channel.sendClose();
                    } catch (IOException e) {
                        log.warn("[WS] Failed to close rejected connection: {}", e.getMessage());
                    }
                    return;
                }
                accept(channel);
            }
        });
    }

    private void accept(WebSocketChannel channel) {
        UndertowMessageSink sink = new UndertowMessageSink(channel);
        ConnectionHandle handle = connections.open(sink);
        String id = handle.getId();

        channel.getCloseSetter().set(c -> connections.close(id, "channel closed"));
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                connections.onMessage(id, message.getData());
            }

            @Override
            protected void onFullPingMessage(WebSocketChannel ch, BufferedBinaryMessage message) throws IOException {
                connections.touch(id);
                super.onFullPingMessage(ch, message);
            }

            @Override
            protected void onFullPongMessage(WebSocketChannel ch, BufferedBinaryMessage message) throws IOException {
                sink.pongReceived();
                connections.touch(id);
                super.onFullPongMessage(ch, message);
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                connections.close(id, "client closed (" + cm.getCode() + ")");
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.warn("[WS] Channel error on {}: {}", id, error.toString());
                connections.close(id, ConnectionEvent.ERROR, "transport error");
                super.onError(ch, error);
            }
        });
        channel.resumeReceives();

        // Peer may have gone away before the close listener was installed
        if (!channel.isOpen()) {
            connections.close(id, "channel closed");
        }
    }
}
