package in.quotestream.bootstrap;

import in.quotestream.config.QuoteStreamConfig;
import in.quotestream.domain.feed.AssetClass;
import in.quotestream.infrastructure.provider.FeedFetcherRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before the engine is built. Invalid numeric or URL settings throw
 * IllegalStateException so the process refuses to start; asset classes
 * without an upstream provider only produce warnings, since subscriptions to
 * them are still accepted (every poll reports "No provider configured").
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(QuoteStreamConfig config, FeedFetcherRegistry fetchers) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        requireRange("PORT", config.port(), 1, 65535);
        requireRange("OUTBOUND_BUFFER_SIZE", config.outboundBufferSize(), 1, 100_000);
        requireRange("FETCH_THREADS", config.fetchThreads(), 1, 1024);
        requirePositive("IDLE_TIMEOUT_SECONDS", config.idleTimeout().getSeconds());
        requirePositive("IDLE_SWEEP_SECONDS", config.idleSweepInterval().getSeconds());
        requirePositive("UPSTREAM_TIMEOUT_SECONDS", config.upstreamTimeout().getSeconds());
        requireHttpUrl("COINGECKO_BASE_URL", config.coinGeckoBaseUrl());
        requireHttpUrl("ALPHA_VANTAGE_BASE_URL", config.alphaVantageBaseUrl());
        if (config.allowedOrigins().isEmpty()) {
            throw new IllegalStateException("❌ INVALID CONFIG: ALLOWED_ORIGINS is empty; use * to allow all origins");
        }

        log.info("✓ Listen address: {}:{}", config.bindHost(), config.port());
        log.info("✓ Outbound buffer: {} updates per connection", config.outboundBufferSize());
        log.info("✓ Idle timeout: {}s (sweep every {}s)",
            config.idleTimeout().getSeconds(), config.idleSweepInterval().getSeconds());
        log.info("✓ Fetch pool: {} threads, upstream timeout {}s",
            config.fetchThreads(), config.upstreamTimeout().getSeconds());
        log.info("✓ Replay cached snapshot on subscribe: {}", config.replayCachedOnSubscribe());

        Set<AssetClass> missing = EnumSet.allOf(AssetClass.class);
        missing.removeAll(fetchers.configuredClasses());
        if (!config.hasAlphaVantageKey()) {
            log.warn("⚠️  ALPHA_VANTAGE_KEY not set - STOCK and FOREX feeds have no provider");
        }
        if (!missing.isEmpty()) {
            log.warn("⚠️  No upstream provider for {} - subscriptions accepted, polls will fail", missing);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: " + name + "=" + value + " (must be between " + min + " and " + max + ")");
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + name + "=" + value + " (must be > 0)");
        }
    }

    private static void requireHttpUrl(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + name + " is empty");
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if ((!"http".equals(scheme) && !"https".equals(scheme)) || uri.getHost() == null) {
                throw new IllegalStateException("❌ INVALID CONFIG: " + name + "=" + value + " (not an http(s) URL)");
            }
        } catch (URISyntaxException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + name + "=" + value + " (" + e.getMessage() + ")", e);
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
