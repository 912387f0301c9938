package com.clinical.phenotype.metrics;

import java.time.Duration;

/**
 * Interface for recording engine metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(String phenotype, String outcome, Duration duration);

    void recordTaskDuration(String task, Duration duration);

    void incrementTaskFailure(String task);

    void recordDefineFanOut(int units);

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheCoalesced();
}
