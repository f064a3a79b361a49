package in.quotestream.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.AssetClass;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Alpha Vantage intraday equity series (1min).
 *
 * URL: {base}/query?function=TIME_SERIES_INTRADAY&symbol=AAPL&interval=1min&apikey=...
 */
public class AlphaVantageStockFetcher extends HttpJsonFetcher {

    private final String apiKey;

    public AlphaVantageStockFetcher(String baseUrl, String apiKey, Duration timeout) {
        this(defaultClient(timeout), baseUrl, apiKey, timeout);
    }

    public AlphaVantageStockFetcher(HttpClient httpClient, String baseUrl, String apiKey, Duration timeout) {
        super(httpClient, baseUrl, timeout);
        this.apiKey = apiKey;
    }

    @Override
    public AssetClass assetClass() {
        return AssetClass.STOCK;
    }

    @Override
    protected URI requestUri(String symbol) {
        return URI.create(baseUrl + "/query?function=TIME_SERIES_INTRADAY"
            + "&symbol=" + encode(symbol)
            + "&interval=1min"
            + "&apikey=" + encode(apiKey));
    }

    @Override
    protected void checkBody(String symbol, JsonNode body) throws UpstreamException {
        AlphaVantageErrors.check(this, symbol, body);
    }
}
