package in.quotestream.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.quotestream.domain.feed.AssetClass;

/**
 * Upstream capability for one asset class.
 *
 * Implementations block on I/O; the scheduler only ever calls them from its
 * fetch pool. The returned payload is opaque to the engine and forwarded as-is.
 */
public interface FeedFetcher {

    /**
     * Asset class this fetcher serves.
     */
    AssetClass assetClass();

    /**
     * Retrieve a fresh snapshot for the symbol.
     *
     * @param symbol provider-specific identifier, case-preserved
     * @return raw provider payload
     * @throws UpstreamException on any provider-side failure, including rate limiting
     */
    JsonNode fetch(String symbol) throws UpstreamException;
}
