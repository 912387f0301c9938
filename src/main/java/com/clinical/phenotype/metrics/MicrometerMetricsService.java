package com.clinical.phenotype.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code phenotype.run.duration}: Timer (tags: phenotype, outcome)</li>
 *   <li>{@code phenotype.task.duration}: Timer (tag: task)</li>
 *   <li>{@code phenotype.task.failures}: Counter (tag: task)</li>
 *   <li>{@code phenotype.define.units}: DistributionSummary of per-define fan-out</li>
 *   <li>{@code phenotype.cache.hit}, {@code phenotype.cache.miss}, {@code phenotype.cache.coalesced}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary fanOutSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheCoalescedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.fanOutSummary = DistributionSummary.builder("phenotype.define.units")
                .description("Units of work dispatched per task define")
                .register(registry);
        this.cacheHitCounter = Counter.builder("phenotype.cache.hit")
                .description("Task results served from the result cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("phenotype.cache.miss")
                .description("Task results computed because the cache had no entry")
                .register(registry);
        this.cacheCoalescedCounter = Counter.builder("phenotype.cache.coalesced")
                .description("Requests that joined an in-flight computation of the same fingerprint")
                .register(registry);
    }

    @Override
    public void recordRunDuration(String phenotype, String outcome, Duration duration) {
        String key = "run:" + phenotype + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("phenotype.run.duration")
                        .description("Duration of phenotype runs")
                        .tag("phenotype", phenotype)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordTaskDuration(String task, Duration duration) {
        String key = "task:" + task;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("phenotype.task.duration")
                        .description("Duration of single task invocations")
                        .tag("task", task)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTaskFailure(String task) {
        String key = "failure:" + task;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("phenotype.task.failures")
                        .description("Task invocations that failed or timed out")
                        .tag("task", task)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordDefineFanOut(int units) {
        fanOutSummary.record(units);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheCoalesced() {
        cacheCoalescedCounter.increment();
    }
}
