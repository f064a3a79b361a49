package in.quotestream.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Alpha Vantage answers HTTP 200 for errors; the error sits in the body.
 * "Note" and "Information" are its rate-limit / quota messages.
 */
final class AlphaVantageErrors {

    private AlphaVantageErrors() {}

    static void check(HttpJsonFetcher fetcher, String symbol, JsonNode body) throws UpstreamException {
        if (body.hasNonNull("Error Message")) {
            throw fetcher.error(symbol, body.get("Error Message").asText());
        }
        if (body.hasNonNull("Note")) {
            throw fetcher.error(symbol, "Rate limited: " + body.get("Note").asText());
        }
        if (body.hasNonNull("Information")) {
            throw fetcher.error(symbol, "Rate limited: " + body.get("Information").asText());
        }
    }
}
