package com.clinical.phenotype.cache;

import com.clinical.phenotype.core.model.ExecutionResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed result store. Entries are immutable lists, so a stored value is always
 * complete; {@link #putIfAbsent} delegates to the cache map's atomic operation.
 */
public class CaffeineResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResultCache.class);

    private final Cache<Fingerprint, List<ExecutionResult>> cache;

    public CaffeineResultCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineResultCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<ExecutionResult>> get(Fingerprint fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public List<ExecutionResult> putIfAbsent(Fingerprint fingerprint, List<ExecutionResult> results) {
        List<ExecutionResult> immutable = List.copyOf(results);
        List<ExecutionResult> existing = cache.asMap().putIfAbsent(fingerprint, immutable);
        return existing != null ? existing : immutable;
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all result cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                0,
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
