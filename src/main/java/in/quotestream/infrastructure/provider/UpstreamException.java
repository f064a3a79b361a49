package in.quotestream.infrastructure.provider;

import in.quotestream.domain.feed.AssetClass;

/**
 * Uniform failure of an upstream fetch: provider error, rate limit, transport
 * failure or unparsable response. All kinds are handled the same way (tick skipped).
 */
public class UpstreamException extends Exception {

    private final AssetClass assetClass;
    private final String symbol;

    public UpstreamException(AssetClass assetClass, String symbol, String message) {
        super(String.format("[%s:%s] %s", assetClass, symbol, message));
        this.assetClass = assetClass;
        this.symbol = symbol;
    }

    public UpstreamException(AssetClass assetClass, String symbol, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", assetClass, symbol, message), cause);
        this.assetClass = assetClass;
        this.symbol = symbol;
    }

    public AssetClass getAssetClass() {
        return assetClass;
    }

    public String getSymbol() {
        return symbol;
    }
}
