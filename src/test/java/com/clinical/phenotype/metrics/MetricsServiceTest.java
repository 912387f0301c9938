package com.clinical.phenotype.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordRunDuration("Sepsis", "COMPLETE", Duration.ofMillis(100));
                noOp.recordTaskDuration("Clarity.TermFinder", Duration.ofMillis(5));
                noOp.incrementTaskFailure("Clarity.TermFinder");
                noOp.recordDefineFanOut(12);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.recordCacheCoalesced();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record run duration per phenotype and outcome")
        void recordRunDuration() {
            metrics.recordRunDuration("Sepsis", "COMPLETE", Duration.ofMillis(150));
            metrics.recordRunDuration("Sepsis", "COMPLETE", Duration.ofMillis(250));
            metrics.recordRunDuration("Sepsis", "FAILED", Duration.ofMillis(10));

            Timer complete = registry.find("phenotype.run.duration")
                    .tag("phenotype", "Sepsis")
                    .tag("outcome", "COMPLETE")
                    .timer();
            Timer failed = registry.find("phenotype.run.duration")
                    .tag("outcome", "FAILED")
                    .timer();

            assertNotNull(complete);
            assertEquals(2, complete.count());
            assertNotNull(failed);
            assertEquals(1, failed.count());
        }

        @Test
        @DisplayName("Should time task invocations per task")
        void recordTaskDuration() {
            metrics.recordTaskDuration("Clarity.ValueExtraction", Duration.ofMillis(20));

            Timer timer = registry.find("phenotype.task.duration")
                    .tag("task", "Clarity.ValueExtraction")
                    .timer();

            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should count task failures per task")
        void incrementTaskFailure() {
            metrics.incrementTaskFailure("Clarity.TermFinder");
            metrics.incrementTaskFailure("Clarity.TermFinder");

            Counter counter = registry.find("phenotype.task.failures")
                    .tag("task", "Clarity.TermFinder")
                    .counter();

            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }

        @Test
        @DisplayName("Should summarize define fan-out")
        void recordDefineFanOut() {
            metrics.recordDefineFanOut(3);
            metrics.recordDefineFanOut(7);

            DistributionSummary summary = registry.find("phenotype.define.units").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(10.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count cache outcomes")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheCoalesced();

            assertEquals(2.0, registry.find("phenotype.cache.hit").counter().count());
            assertEquals(1.0, registry.find("phenotype.cache.miss").counter().count());
            assertEquals(1.0, registry.find("phenotype.cache.coalesced").counter().count());
        }
    }
}
