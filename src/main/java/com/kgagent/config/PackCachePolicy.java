package com.kgagent.config;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;

/**
 * Eviction policy of the context pack cache: entries expire {@code maxAge} after they were
 * loaded and at most {@code maxEntries} packs are kept.
 *
 * @param maxAge     time-to-live of a loaded pack.
 * @param maxEntries maximum number of cached packs.
 * @param ticker     time source; tests pass a manual ticker.
 */
public record PackCachePolicy(Duration maxAge, long maxEntries, Ticker ticker) {

    public static PackCachePolicy of(Duration maxAge, long maxEntries) {
        return new PackCachePolicy(maxAge, maxEntries, Ticker.systemTicker());
    }
}
