package com.clinical.phenotype.cache;

/**
 * Cache metrics.
 *
 * @param hitCount       lookups answered from the store
 * @param missCount      lookups that started a computation
 * @param coalescedCount lookups that joined a computation already in flight
 * @param evictionCount  entries evicted by size or TTL
 * @param size           current number of entries
 */
public record CacheStats(long hitCount, long missCount, long coalescedCount, long evictionCount, long size) {

    /**
     * Share of lookups that did not start a computation (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount + coalescedCount;
        return total == 0 ? 0.0 : (double) (hitCount + coalescedCount) / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}
