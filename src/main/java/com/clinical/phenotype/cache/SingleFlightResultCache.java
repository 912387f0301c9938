package com.clinical.phenotype.cache;

import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.metrics.MetricsService;
import com.clinical.phenotype.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Coordinates a {@link ResultCache} so that each fingerprint is computed at most once at a time.
 *
 * <p>The first caller for a fingerprint (the leader) registers a promise and starts the
 * computation; callers arriving while it runs receive the same promise. The result is written
 * to the store before the promise is released, so a caller that misses the in-flight entry
 * finds the stored result. Failed computations are not cached and the next caller retries.
 * Store failures are logged and treated as misses.</p>
 *
 * <p>Shared by all runs of an engine; reads are lock-free.</p>
 */
public class SingleFlightResultCache {
    private static final Logger log = LoggerFactory.getLogger(SingleFlightResultCache.class);

    private final ResultCache store;
    private final MetricsService metrics;
    private final ConcurrentMap<Fingerprint, CompletableFuture<List<ExecutionResult>>> inFlight =
            new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();

    public SingleFlightResultCache(ResultCache store) {
        this(store, new NoOpMetricsService());
    }

    public SingleFlightResultCache(ResultCache store, MetricsService metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Returns the cached results for {@code fingerprint}, joins a running computation, or starts
     * {@code computation} and caches what it produces.
     *
     * @param computation started only by the leader; may complete exceptionally
     */
    public CompletableFuture<List<ExecutionResult>> getOrCompute(
            Fingerprint fingerprint, Supplier<CompletableFuture<List<ExecutionResult>>> computation) {
        Optional<List<ExecutionResult>> cached = lookup(fingerprint);
        if (cached.isPresent()) {
            recordHit(fingerprint);
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<List<ExecutionResult>> promise = new CompletableFuture<>();
        CompletableFuture<List<ExecutionResult>> existing = inFlight.putIfAbsent(fingerprint, promise);
        if (existing != null) {
            coalesced.incrementAndGet();
            metrics.recordCacheCoalesced();
            log.debug("cache.coalesced fingerprint={}", fingerprint);
            return existing;
        }

        // a previous leader may have stored and left between our lookup and putIfAbsent
        cached = lookup(fingerprint);
        if (cached.isPresent()) {
            inFlight.remove(fingerprint, promise);
            recordHit(fingerprint);
            promise.complete(cached.get());
            return promise;
        }

        misses.incrementAndGet();
        metrics.recordCacheMiss();
        log.debug("cache.miss fingerprint={}", fingerprint);

        CompletableFuture<List<ExecutionResult>> running;
        try {
            running = computation.get();
        } catch (RuntimeException e) {
            inFlight.remove(fingerprint, promise);
            promise.completeExceptionally(e);
            return promise;
        }
        running.whenComplete((results, error) -> {
            if (error != null) {
                inFlight.remove(fingerprint, promise);
                promise.completeExceptionally(error);
                return;
            }
            try {
                List<ExecutionResult> stored = store(fingerprint, results == null ? List.of() : results);
                inFlight.remove(fingerprint, promise);
                promise.complete(stored);
            } catch (RuntimeException e) {
                inFlight.remove(fingerprint, promise);
                promise.completeExceptionally(e);
            }
        });
        return promise;
    }

    private Optional<List<ExecutionResult>> lookup(Fingerprint fingerprint) {
        try {
            return store.get(fingerprint);
        } catch (CacheException e) {
            log.warn("Result cache lookup failed for {}, recomputing: {}", fingerprint, e.getMessage());
            return Optional.empty();
        }
    }

    private List<ExecutionResult> store(Fingerprint fingerprint, List<ExecutionResult> results) {
        try {
            return store.putIfAbsent(fingerprint, results);
        } catch (CacheException e) {
            log.warn("Result cache write failed for {}, result not cached: {}", fingerprint, e.getMessage());
            return List.copyOf(results);
        }
    }

    private void recordHit(Fingerprint fingerprint) {
        hits.incrementAndGet();
        metrics.recordCacheHit();
        log.debug("cache.hit fingerprint={}", fingerprint);
    }

    /**
     * Number of computations currently running.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public void invalidateAll() {
        store.invalidateAll();
    }

    /**
     * Coordinator counters combined with the store's eviction and size figures.
     */
    public CacheStats getStats() {
        CacheStats storeStats;
        try {
            storeStats = store.getStats();
        } catch (CacheException e) {
            log.warn("Result cache stats unavailable: {}", e.getMessage());
            storeStats = CacheStats.empty();
        }
        return new CacheStats(hits.get(), misses.get(), coalesced.get(),
                storeStats.evictionCount(), storeStats.size());
    }
}
