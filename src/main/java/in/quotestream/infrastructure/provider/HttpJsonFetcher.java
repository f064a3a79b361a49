package in.quotestream.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Base for fetchers that issue one GET and parse a JSON body.
 *
 * Transport failures, non-200 statuses and unparsable bodies all surface as
 * {@link UpstreamException}; subclasses add provider-specific error detection.
 */
public abstract class HttpJsonFetcher implements FeedFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpJsonFetcher.class);
    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final Duration timeout;
    protected final String baseUrl;

    protected HttpJsonFetcher(HttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
    }

    protected static HttpClient defaultClient(Duration timeout) {
        return HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    /**
     * Request URI for a symbol.
     */
    protected abstract URI requestUri(String symbol) throws UpstreamException;

    /**
     * Inspect a parsed body for provider-level errors. Default accepts everything.
     */
    protected void checkBody(String symbol, JsonNode body) throws UpstreamException {
    }

    @Override
    public JsonNode fetch(String symbol) throws UpstreamException {
        URI uri = requestUri(symbol);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException(assetClass(), symbol, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(assetClass(), symbol, "Request interrupted", e);
        }

        if (response.statusCode() == 429) {
            throw new UpstreamException(assetClass(), symbol, "Rate limited (HTTP 429)");
        }
        if (response.statusCode() != 200) {
            throw new UpstreamException(assetClass(), symbol, "HTTP " + response.statusCode());
        }

        JsonNode body;
        try {
            body = MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new UpstreamException(assetClass(), symbol, "Unparsable response: " + e.getMessage(), e);
        }
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new UpstreamException(assetClass(), symbol, "Empty response");
        }

        checkBody(symbol, body);
        log.debug("[{}] Fetched {} ({} bytes)", getClass().getSimpleName(), symbol, response.body().length());
        return body;
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected final UpstreamException error(String symbol, String message) {
        return new UpstreamException(assetClass(), symbol, message);
    }
}
