package in.quotestream.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.AssetClass;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Alpha Vantage intraday FX series. Symbols are currency pairs: {@code EUR/USD}.
 */
public class AlphaVantageForexFetcher extends HttpJsonFetcher {

    private final String apiKey;

    public AlphaVantageForexFetcher(String baseUrl, String apiKey, Duration timeout) {
        this(defaultClient(timeout), baseUrl, apiKey, timeout);
    }

    public AlphaVantageForexFetcher(HttpClient httpClient, String baseUrl, String apiKey, Duration timeout) {
        super(httpClient, baseUrl, timeout);
        this.apiKey = apiKey;
    }

    @Override
    public AssetClass assetClass() {
        return AssetClass.FOREX;
    }

    @Override
    protected URI requestUri(String symbol) throws UpstreamException {
        String[] pair = symbol.split("/");
        if (pair.length != 2 || pair[0].isBlank() || pair[1].isBlank()) {
            throw error(symbol, "Expected currency pair FROM/TO");
        }
        return URI.create(baseUrl + "/query?function=FX_INTRADAY"
            + "&from_symbol=" + encode(pair[0])
            + "&to_symbol=" + encode(pair[1])
            + "&interval=1min"
            + "&apikey=" + encode(apiKey));
    }

    @Override
    protected void checkBody(String symbol, JsonNode body) throws UpstreamException {
        AlphaVantageErrors.check(this, symbol, body);
    }
}
