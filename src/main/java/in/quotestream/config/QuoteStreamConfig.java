package in.quotestream.config;

import in.quotestream.util.Env;

import java.time.Duration;
import java.util.List;

/**
 * Immutable runtime configuration, resolved once at startup.
 */
public record QuoteStreamConfig(
    int port,
    String bindHost,
    int outboundBufferSize,
    Duration idleTimeout,
    Duration idleSweepInterval,
    int fetchThreads,
    boolean replayCachedOnSubscribe,
    String alphaVantageKey,
    String alphaVantageBaseUrl,
    String coinGeckoBaseUrl,
    Duration upstreamTimeout,
    List<String> allowedOrigins
) {
    public static final String DEFAULT_ALPHA_VANTAGE_URL = "https://www.alphavantage.co";
    public static final String DEFAULT_COINGECKO_URL = "https://api.coingecko.com";

    public static QuoteStreamConfig fromEnv() {
        return new QuoteStreamConfig(
            Env.getInt("PORT", 4000),
            Env.get("BIND_HOST", "0.0.0.0"),
            Env.getInt("OUTBOUND_BUFFER_SIZE", 256),
            Duration.ofSeconds(Env.getInt("IDLE_TIMEOUT_SECONDS", 300)),
            Duration.ofSeconds(Env.getInt("IDLE_SWEEP_SECONDS", 30)),
            Env.getInt("FETCH_THREADS", 16),
            Env.getBool("REPLAY_CACHED_ON_SUBSCRIBE", true),
            Env.get("ALPHA_VANTAGE_KEY", null),
            Env.get("ALPHA_VANTAGE_BASE_URL", DEFAULT_ALPHA_VANTAGE_URL),
            Env.get("COINGECKO_BASE_URL", DEFAULT_COINGECKO_URL),
            Duration.ofSeconds(Env.getInt("UPSTREAM_TIMEOUT_SECONDS", 10)),
            Env.getList("ALLOWED_ORIGINS", List.of("*"))
        );
    }

    /**
     * Built-in defaults, the same values {@link #fromEnv()} resolves to when nothing is set.
     */
    public static QuoteStreamConfig defaults() {
        return new QuoteStreamConfig(
            4000, "0.0.0.0", 256,
            Duration.ofSeconds(300), Duration.ofSeconds(30),
            16, true,
            null, DEFAULT_ALPHA_VANTAGE_URL, DEFAULT_COINGECKO_URL,
            Duration.ofSeconds(10), List.of("*"));
    }

    public boolean hasAlphaVantageKey() {
        return alphaVantageKey != null && !alphaVantageKey.isBlank();
    }
}
