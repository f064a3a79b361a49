package in.quotestream.infrastructure.provider;

import in.quotestream.domain.feed.AssetClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Asset class to fetcher lookup. Classes without a registered fetcher are still
 * subscribable; their ticks fail with "no provider configured".
 */
public final class FeedFetcherRegistry {
    private static final Logger log = LoggerFactory.getLogger(FeedFetcherRegistry.class);

    private final Map<AssetClass, FeedFetcher> fetchers = new EnumMap<>(AssetClass.class);

    public FeedFetcherRegistry register(FeedFetcher fetcher) {
        FeedFetcher previous = fetchers.put(fetcher.assetClass(), fetcher);
        if (previous != null) {
            log.warn("[PROVIDER] Replaced fetcher for {}: {} -> {}",
                fetcher.assetClass(), previous.getClass().getSimpleName(), fetcher.getClass().getSimpleName());
        } else {
            log.info("[PROVIDER] Registered {} for {}", fetcher.getClass().getSimpleName(), fetcher.assetClass());
        }
        return this;
    }

    public Optional<FeedFetcher> find(AssetClass assetClass) {
        return Optional.ofNullable(fetchers.get(assetClass));
    }

    public Set<AssetClass> configuredClasses() {
        return Collections.unmodifiableSet(fetchers.keySet());
    }
}
