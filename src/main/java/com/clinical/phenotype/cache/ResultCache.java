package com.clinical.phenotype.cache;

import com.clinical.phenotype.core.model.ExecutionResult;

import java.util.List;
import java.util.Optional;

/**
 * Store for task results keyed by {@link Fingerprint}. Implementations must make
 * {@link #putIfAbsent} atomic: a reader sees either no entry or a complete result list.
 * Implementations may throw {@link CacheException}.
 */
public interface ResultCache {

    /**
     * @return the cached results, or empty if not cached
     */
    Optional<List<ExecutionResult>> get(Fingerprint fingerprint);

    /**
     * Stores {@code results} unless an entry exists.
     *
     * @return the entry that is now stored, either the existing one or {@code results}
     */
    List<ExecutionResult> putIfAbsent(Fingerprint fingerprint, List<ExecutionResult> results);

    void invalidateAll();

    CacheStats getStats();
}
