package com.clinical.phenotype.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(String phenotype, String outcome, Duration duration) {
    }

    @Override
    public void recordTaskDuration(String task, Duration duration) {
    }

    @Override
    public void incrementTaskFailure(String task) {
    }

    @Override
    public void recordDefineFanOut(int units) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheCoalesced() {
    }
}
