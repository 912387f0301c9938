package com.clinical.phenotype.cache;

import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SingleFlightResultCacheTest {

    private static final List<ExecutionResult> RESULTS =
            List.of(ExecutionResult.ofPatient("p1", Value.bool(true)));

    private final Fingerprint key = Fingerprint.of(Map.of("task", "T", "subject", "p1"));

    @Test
    @DisplayName("Should compute once and serve later calls from the store")
    void testComputeOnce() throws Exception {
        SingleFlightResultCache cache = new SingleFlightResultCache(new CaffeineResultCache(CacheConfig.defaults()));
        AtomicInteger computations = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            List<ExecutionResult> results = cache.getOrCompute(key, () -> {
                computations.incrementAndGet();
                return CompletableFuture.completedFuture(RESULTS);
            }).get();
            assertEquals(RESULTS, results);
        }

        assertEquals(1, computations.get());
        CacheStats stats = cache.getStats();
        assertEquals(1, stats.missCount());
        assertEquals(2, stats.hitCount());
    }

    @Test
    @DisplayName("Concurrent callers should share one in-flight computation")
    void testCoalescing() throws Exception {
        SingleFlightResultCache cache = new SingleFlightResultCache(new CaffeineResultCache(CacheConfig.defaults()));
        AtomicInteger computations = new AtomicInteger();
        CompletableFuture<List<ExecutionResult>> leader = new CompletableFuture<>();
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch joined = new CountDownLatch(callers);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<CompletableFuture<CompletableFuture<List<ExecutionResult>>>> calls = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                calls.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    CompletableFuture<List<ExecutionResult>> f = cache.getOrCompute(key, () -> {
                        computations.incrementAndGet();
                        return leader;
                    });
                    joined.countDown();
                    return f;
                }, pool));
            }
            start.countDown();
            assertTrue(joined.await(5, TimeUnit.SECONDS));
            assertEquals(1, cache.inFlightCount());

            leader.complete(RESULTS);
            for (CompletableFuture<CompletableFuture<List<ExecutionResult>>> call : calls) {
                assertEquals(RESULTS, call.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, computations.get());
        assertEquals(0, cache.inFlightCount());
        assertEquals(callers - 1, cache.getStats().coalescedCount());
    }

    @Test
    @DisplayName("A failed computation should not be cached")
    void testFailureNotCached() throws Exception {
        SingleFlightResultCache cache = new SingleFlightResultCache(new CaffeineResultCache(CacheConfig.defaults()));

        CompletableFuture<List<ExecutionResult>> failed = cache.getOrCompute(key,
                () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertEquals("boom", e.getCause().getMessage());
        assertEquals(0, cache.inFlightCount());

        AtomicInteger retries = new AtomicInteger();
        List<ExecutionResult> results = cache.getOrCompute(key, () -> {
            retries.incrementAndGet();
            return CompletableFuture.completedFuture(RESULTS);
        }).get();
        assertEquals(RESULTS, results);
        assertEquals(1, retries.get());
    }

    @Test
    @DisplayName("A failing store should degrade to recomputation")
    void testStoreFailure() throws Exception {
        ResultCache store = mock(ResultCache.class);
        when(store.get(any())).thenThrow(new CacheException("store down"));
        when(store.putIfAbsent(any(), any())).thenThrow(new CacheException("store down"));
        SingleFlightResultCache cache = new SingleFlightResultCache(store);

        List<ExecutionResult> results = cache.getOrCompute(key,
                () -> CompletableFuture.completedFuture(RESULTS)).get();
        assertEquals(RESULTS, results);
    }
}
