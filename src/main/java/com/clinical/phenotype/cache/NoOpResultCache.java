package com.clinical.phenotype.cache;

import com.clinical.phenotype.core.model.ExecutionResult;

import java.util.List;
import java.util.Optional;

/**
 * Store that keeps nothing. Used when caching is disabled.
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public Optional<List<ExecutionResult>> get(Fingerprint fingerprint) {
        return Optional.empty();
    }

    @Override
    public List<ExecutionResult> putIfAbsent(Fingerprint fingerprint, List<ExecutionResult> results) {
        return results;
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
