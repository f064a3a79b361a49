package in.quotestream.domain.feed;

import java.time.Duration;
import java.util.Locale;

/**
 * Closed set of pollable asset classes.
 *
 * Each class carries the fixed cadence at which its feeds are polled upstream.
 */
public enum AssetClass {
    STOCK(Duration.ofSeconds(5)),
    CRYPTO(Duration.ofSeconds(3)),
    FOREX(Duration.ofSeconds(10)),
    BOND(Duration.ofSeconds(60)),
    COMMODITY(Duration.ofSeconds(30)),
    INDEX(Duration.ofSeconds(10)),
    ETF(Duration.ofSeconds(5)),
    ATF(Duration.ofSeconds(300)),      // Alternative investment funds
    REAL_ESTATE(Duration.ofSeconds(3600));

    private final Duration pollInterval;

    AssetClass(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * Parse a wire name (case-insensitive).
     *
     * @throws InvalidFeedKeyException if the name is not one of the supported classes
     */
    public static AssetClass parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidFeedKeyException("Missing asset class");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFeedKeyException("Unsupported asset class: " + name);
        }
    }
}
