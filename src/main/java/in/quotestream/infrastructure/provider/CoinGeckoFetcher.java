package in.quotestream.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.AssetClass;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * CoinGecko simple price in USD with 24h change. Symbols are CoinGecko ids
 * ({@code bitcoin}, {@code ethereum}); no API key needed.
 */
public class CoinGeckoFetcher extends HttpJsonFetcher {

    public CoinGeckoFetcher(String baseUrl, Duration timeout) {
        this(defaultClient(timeout), baseUrl, timeout);
    }

    public CoinGeckoFetcher(HttpClient httpClient, String baseUrl, Duration timeout) {
        super(httpClient, baseUrl, timeout);
    }

    @Override
    public AssetClass assetClass() {
        return AssetClass.CRYPTO;
    }

    @Override
    protected URI requestUri(String symbol) {
        return URI.create(baseUrl + "/api/v3/simple/price"
            + "?ids=" + encode(symbol)
            + "&vs_currencies=usd"
            + "&include_24hr_change=true");
    }

    @Override
    protected void checkBody(String symbol, JsonNode body) throws UpstreamException {
        if (body.has("status") && body.get("status").has("error_message")) {
            throw error(symbol, body.get("status").get("error_message").asText());
        }
        // Unknown ids come back as an empty object
        if (body.isObject() && body.isEmpty()) {
            throw error(symbol, "Unknown coin id");
        }
    }
}
