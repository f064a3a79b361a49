package in.quotestream.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.quotestream.service.feed.EngineStatus;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * GET /health
 *
 * <pre>
 * {"status":"healthy","timestamp":"2024-05-01T10:00:00Z","connections":3,"activePollTasks":2,"subscribedFeeds":2}
 * </pre>
 */
public final class HealthHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Supplier<EngineStatus> status;

    public HealthHandler(Supplier<EngineStatus> status) {
        this.status = status;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        try {
            EngineStatus current = status.get();
            health.put("status", "healthy");
            health.put("timestamp", current.timestamp().toString());
            health.put("connections", current.connections());
            health.put("activePollTasks", current.activePollTasks());
            health.put("subscribedFeeds", current.subscribedFeeds());
            exchange.setStatusCode(StatusCodes.OK);
        } catch (RuntimeException e) {
            log.error("[HEALTH] Status check failed: {}", e.getMessage(), e);
            health.put("status", "unhealthy");
            health.put("error", e.getMessage());
            exchange.setStatusCode(StatusCodes.SERVICE_UNAVAILABLE);
        }
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(health.toString(), StandardCharsets.UTF_8);
    }
}
