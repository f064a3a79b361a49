package in.quotestream.service.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.quotestream.domain.feed.FeedKey;
import in.quotestream.domain.feed.MarketUpdate;

/**
 * JSON wire format shared by every transport.
 *
 * Server frames carry a {@code type}: connected, subscribed, unsubscribed,
 * market_update, pong, error. Timestamps are ISO-8601 instants.
 */
public final class FeedProtocol {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONNECTED = "connected";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String MARKET_UPDATE = "market_update";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    private FeedProtocol() {}

    public static ClientRequest parse(String raw) throws JsonProcessingException {
        return MAPPER.readValue(raw, ClientRequest.class);
    }

    public static String connected(String connectionId) {
        ObjectNode node = frame(CONNECTED);
        node.put("connectionId", connectionId);
        return write(node);
    }

    public static String subscribed(FeedKey key) {
        return keyFrame(SUBSCRIBED, key);
    }

    public static String unsubscribed(FeedKey key) {
        return keyFrame(UNSUBSCRIBED, key);
    }

    public static String marketUpdate(MarketUpdate update) {
        ObjectNode node = frame(MARKET_UPDATE);
        node.put("assetClass", update.key().assetClass().name());
        node.put("symbol", update.key().symbol());
        node.set("data", update.data());
        node.put("timestamp", update.timestamp().toString());
        return write(node);
    }

    public static String pong(String nonce) {
        ObjectNode node = frame(PONG);
        node.put("nonce", nonce == null ? "" : nonce);
        return write(node);
    }

    public static String error(String message) {
        ObjectNode node = frame(ERROR);
        node.put("message", message);
        return write(node);
    }

    private static String keyFrame(String type, FeedKey key) {
        ObjectNode node = frame(type);
        node.put("assetClass", key.assetClass().name());
        node.put("symbol", key.symbol());
        return write(node);
    }

    private static ObjectNode frame(String type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        return node;
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // Tree nodes built here always serialize
            throw new IllegalStateException("Failed to serialize " + node.get("type"), e);
        }
    }
}
