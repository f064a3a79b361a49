package in.quotestream.domain.feed;

import in.quotestream.security.InputValidator;

import java.util.Objects;

/**
 * Identity of a pollable feed: (asset class, symbol).
 *
 * Symbols are case-preserved; "bitcoin" and "BITCOIN" are distinct feeds.
 */
public record FeedKey(AssetClass assetClass, String symbol) {

    private static final InputValidator VALIDATOR = new InputValidator();

    public FeedKey {
        Objects.requireNonNull(assetClass, "assetClass");
        if (!VALIDATOR.isValidSymbol(symbol)) {
            throw new InvalidFeedKeyException("Invalid symbol: " + symbol);
        }
    }

    /**
     * Build a key from wire values, validating both parts.
     */
    public static FeedKey of(String assetClass, String symbol) {
        return new FeedKey(AssetClass.parse(assetClass), symbol);
    }

    public static FeedKey of(AssetClass assetClass, String symbol) {
        return new FeedKey(assetClass, symbol);
    }

    /**
     * Cache/log form, e.g. {@code STOCK:AAPL}.
     */
    public String asString() {
        return assetClass.name() + ":" + symbol;
    }

    @Override
    public String toString() {
        return asString();
    }
}
