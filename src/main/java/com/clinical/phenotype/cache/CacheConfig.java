package com.clinical.phenotype.cache;

/**
 * Configuration for the task result cache.
 *
 * @param maxSize    maximum number of fingerprints kept
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether results are cached at all; single-flight coalescing applies either way
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 fingerprints, one hour TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    /**
     * Store matching this configuration.
     */
    public ResultCache createStore() {
        return enabled ? new CaffeineResultCache(this) : new NoOpResultCache();
    }
}
