package com.clinical.phenotype.api;

import com.clinical.phenotype.aggregate.InMemoryResultSink;
import com.clinical.phenotype.aggregate.PhenotypeMembership;
import com.clinical.phenotype.aggregate.ResultSink;
import com.clinical.phenotype.binder.CompiledPhenotype;
import com.clinical.phenotype.binder.UnresolvedReferenceException;
import com.clinical.phenotype.cache.CacheConfig;
import com.clinical.phenotype.collaborator.CollaboratorUnavailableException;
import com.clinical.phenotype.collaborator.DocumentStore;
import com.clinical.phenotype.collaborator.InMemoryCohortResolver;
import com.clinical.phenotype.collaborator.InMemoryDocumentStore;
import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.execution.SubjectFailure;
import com.clinical.phenotype.graph.CyclicDependencyException;
import com.clinical.phenotype.metrics.MicrometerMetricsService;
import com.clinical.phenotype.script.PhenotypeSyntaxException;
import com.clinical.phenotype.task.StubTask;
import com.clinical.phenotype.task.TaskRegistry;
import com.clinical.phenotype.task.TaskSignature;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PhenotypeEngineTest {

    private static final String THRESHOLD = """
            phenotype "Ejection" version "2";
            include NLP called N;
            define Score: N.Score();
            define final High: Score > 5;
            """;

    private final InMemoryDocumentStore store = new InMemoryDocumentStore()
            .add("d1", "p1", "Echo", "7")
            .add("d2", "p2", "Echo", "4")
            .add("d3", "p3", "Echo", "5");
    private final InMemoryCohortResolver cohorts = new InMemoryCohortResolver();
    private final InMemoryResultSink sink = new InMemoryResultSink();
    private final StubTask score = StubTask.numberPerDocument("Score");
    private final StubTask flaky = new StubTask("Flaky", TaskSignature.numeric(), input -> {
        if (input.subjectKey().equals("p2")) {
            throw new IllegalArgumentException("unreadable note");
        }
        return List.of(ExecutionResult.ofPatient(input.subjectKey(), Value.number(9)));
    });
    private final StubTask slow = new StubTask("Slow", TaskSignature.numeric(), input -> {
        Thread.sleep(2_000);
        return List.of();
    });

    private TaskRegistry registry;
    private PhenotypeEngine engine;

    @BeforeEach
    void setUp() {
        registry = TaskRegistry.builder()
                .register("NLP", score)
                .register("NLP", flaky)
                .register("NLP", slow)
                .build();
        engine = newEngine(store, sink, EngineOptions.builder().workerThreads(4).build());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private PhenotypeEngine newEngine(DocumentStore documents, ResultSink resultSink, EngineOptions options) {
        return PhenotypeEngine.builder()
                .taskRegistry(registry)
                .documentStore(documents)
                .cohortResolver(cohorts)
                .resultSink(resultSink)
                .options(options)
                .build();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should require a task registry")
        void testRequiresRegistry() {
            PhenotypeEngine.Builder builder = PhenotypeEngine.builder()
                    .documentStore(store)
                    .cohortResolver(cohorts);
            assertThrows(IllegalStateException.class, builder::build);
        }

        @Test
        @DisplayName("Should require a document store")
        void testRequiresDocumentStore() {
            PhenotypeEngine.Builder builder = PhenotypeEngine.builder()
                    .taskRegistry(registry)
                    .cohortResolver(cohorts);
            assertThrows(IllegalStateException.class, builder::build);
        }

        @Test
        @DisplayName("Options should reject non-positive worker counts and timeouts")
        void testOptionsValidation() {
            assertThrows(IllegalArgumentException.class, () -> EngineOptions.builder().workerThreads(0));
            assertThrows(IllegalArgumentException.class, () -> EngineOptions.builder().taskTimeout(Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessTests {

        @Test
        @DisplayName("Should report threshold membership per patient")
        void testThreshold() {
            RunResult result = engine.run(THRESHOLD);

            assertTrue(result.isComplete(), () -> String.valueOf(result.getFailure()));
            assertTrue(result.state().isTerminal());
            assertEquals("Ejection", result.phenotype());
            assertEquals(List.of(RunState.PARSED, RunState.VALIDATED, RunState.SCHEDULED, RunState.EXECUTING,
                    RunState.AGGREGATED, RunState.COMPLETE), result.transitions());
            assertTrue(result.membership("High", "p1").orElseThrow().qualifies());
            assertFalse(result.membership("High", "p2").orElseThrow().qualifies());
            assertFalse(result.membership("High", "p3").orElseThrow().qualifies());
            assertEquals(Map.of("Score", List.of(Value.number(7))),
                    result.membership("High", "p1").orElseThrow().supportingValues());
            assertTrue(result.failures().isEmpty());
            assertEquals(3, result.unitsDispatched());
        }

        @Test
        @DisplayName("Should publish every membership to the sink in subject order")
        void testSink() {
            engine.run(THRESHOLD);

            List<PhenotypeMembership> records = sink.records();
            assertEquals(List.of("p1", "p2", "p3"), records.stream().map(PhenotypeMembership::subjectId).toList());
            assertTrue(records.stream().allMatch(r -> r.phenotype().equals("Ejection")));
        }

        @Test
        @DisplayName("Should report several final defines independently")
        void testMultipleFinals() {
            RunResult result = engine.run("""
                    phenotype "Two" version "1";
                    include NLP called N;
                    define Score: N.Score();
                    define final High: Score > 5;
                    define final Low: Score < 5;
                    """);

            assertEquals(3, result.membershipsFor("High").size());
            assertEquals(3, result.membershipsFor("Low").size());
            assertTrue(result.membership("Low", "p2").orElseThrow().qualifies());
            assertFalse(result.membership("Low", "p3").orElseThrow().qualifies());
            assertEquals(List.of("High", "High", "High", "Low", "Low", "Low"),
                    result.memberships().stream().map(PhenotypeMembership::finalDefine).toList());
        }

        @Test
        @DisplayName("Cohort members without documents should get a negative membership")
        void testCohortMemberWithoutDocuments() {
            cohorts.register("6", Set.of("p1", "p4"));
            RunResult result = engine.run("""
                    phenotype "Scoped" version "1";
                    include NLP called N;
                    include OHDSI called OHDSI;
                    cohort Adults: OHDSI.getCohort(6);
                    define Score: N.Score({cohort: Adults});
                    define final High: Score > 5;
                    """);

            assertTrue(result.isComplete());
            assertEquals(List.of("p1", "p4"),
                    result.membershipsFor("High").stream().map(PhenotypeMembership::subjectId).toList());
            assertFalse(result.membership("High", "p4").orElseThrow().qualifies());
            assertTrue(result.membership("High", "p4").orElseThrow().supportingValues().isEmpty());
        }

        @Test
        @DisplayName("A script without final defines should complete with no memberships")
        void testNoFinalDefine() {
            RunResult result = engine.run("""
                    phenotype "Draft" version "1";
                    include NLP called N;
                    define Score: N.Score();
                    """);

            assertTrue(result.isComplete());
            assertTrue(result.memberships().isEmpty());
            assertEquals(3, result.unitsDispatched());
        }

        @Test
        @DisplayName("Compiled phenotypes should be executable repeatedly")
        void testCompileThenExecute() {
            CompiledPhenotype compiled = engine.compile(THRESHOLD);
            RunResult first = engine.execute(compiled);
            RunResult second = engine.execute(compiled);

            assertNotEquals(first.runId(), second.runId());
            assertEquals(first.memberships(), second.memberships());
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("A second run should reuse every cached unit")
        void testReuseAcrossRuns() {
            engine.run(THRESHOLD);
            RunResult second = engine.run(THRESHOLD);

            assertTrue(second.isComplete());
            assertEquals(0, second.unitsDispatched());
            assertEquals(3, second.cacheHits());
            assertEquals(3, score.calls());
            assertEquals(3, engine.getCacheStats().missCount());
        }

        @Test
        @DisplayName("Identical invocations in two defines should execute once per patient")
        void testIdenticalDefines() {
            RunResult result = engine.run("""
                    phenotype "Twice" version "1";
                    include NLP called N;
                    define A: N.Score();
                    define B: N.Score();
                    define final Both: A > 5 AND B > 5;
                    """);

            assertTrue(result.isComplete());
            assertEquals(3, score.calls());
            assertTrue(result.membership("Both", "p1").orElseThrow().qualifies());
        }

        @Test
        @DisplayName("Invalidating the cache should force re-execution")
        void testInvalidate() {
            engine.run(THRESHOLD);
            engine.invalidateCache();
            RunResult second = engine.run(THRESHOLD);

            assertEquals(3, second.unitsDispatched());
            assertEquals(6, score.calls());
        }

        @Test
        @DisplayName("A disabled cache should execute every run")
        void testDisabledCache() {
            try (PhenotypeEngine uncached = newEngine(store, null, EngineOptions.builder()
                    .cacheConfig(CacheConfig.disabled())
                    .build())) {
                uncached.run(THRESHOLD);
                RunResult second = uncached.run(THRESHOLD);
                assertEquals(3, second.unitsDispatched());
            }
        }
    }

    @Nested
    @DisplayName("Per-subject failures")
    class SubjectFailureTests {

        @Test
        @DisplayName("A failing patient should be reported without failing the run")
        void testFaultIsolation() {
            RunResult result = engine.run("""
                    phenotype "Flaky" version "1";
                    include NLP called N;
                    define Score: N.Flaky();
                    define final High: Score > 5;
                    """);

            assertEquals(RunState.COMPLETE, result.state());
            assertTrue(result.membership("High", "p1").orElseThrow().qualifies());
            assertTrue(result.membership("High", "p2").isEmpty());
            assertEquals(List.of("Score", "High"),
                    result.failures().stream().map(SubjectFailure::define).toList());
            assertTrue(result.failures().stream().allMatch(f -> f.subjectKey().equals("p2")));
            assertTrue(result.failures().get(0).message().contains("unreadable note"));
        }

        @Test
        @DisplayName("A failing define should not affect an independent define over the same patient")
        void testIndependentSibling() {
            RunResult result = engine.run("""
                    phenotype "Siblings" version "1";
                    include NLP called N;
                    define Bad: N.Flaky();
                    define Good: N.Score();
                    define final GoodHigh: Good > 3;
                    """);

            assertEquals(RunState.COMPLETE, result.state());
            PhenotypeMembership p2 = result.membership("GoodHigh", "p2").orElseThrow();
            assertTrue(p2.qualifies());
            assertEquals(List.of(Value.number(4)), p2.supportingValues().get("Good"));
            assertEquals(3, result.membershipsFor("GoodHigh").size());
            assertEquals(1, result.failures().size());
            SubjectFailure failure = result.failures().get(0);
            assertEquals("Bad", failure.define());
            assertEquals("p2", failure.subjectKey());
        }

        @Test
        @DisplayName("A task over its timeout should fail only its units")
        void testTimeout() {
            try (PhenotypeEngine impatient = newEngine(store, null, EngineOptions.builder()
                    .workerThreads(4)
                    .taskTimeout(Duration.ofMillis(100))
                    .build())) {
                RunResult result = impatient.run("""
                        phenotype "Slow" version "1";
                        include NLP called N;
                        define Score: N.Slow();
                        define final High: Score > 5;
                        """);

                assertTrue(result.isComplete());
                assertTrue(result.memberships().isEmpty());
                assertEquals(6, result.failures().size());
                assertTrue(result.failures().get(0).message().contains("timed out"));
            }
        }
    }

    @Nested
    @DisplayName("Failed runs")
    class FailedRunTests {

        @Test
        @DisplayName("A syntax error should fail the run before validation")
        void testSyntaxError() {
            RunResult result = engine.run("phenotype \"Broken\" version \"1\"\ndefine X: 1;");

            assertEquals(RunState.FAILED, result.state());
            assertEquals(List.of(RunState.PARSED, RunState.FAILED), result.transitions());
            assertNull(result.phenotype());
            assertInstanceOf(PhenotypeSyntaxException.class, result.getFailure().orElseThrow());
            assertEquals(0, score.calls());
        }

        @Test
        @DisplayName("A cycle should fail the run at validation")
        void testCycle() {
            RunResult result = engine.run("""
                    phenotype "Loop" version "1";
                    define A: B;
                    define B: A;
                    """);

            assertEquals(List.of(RunState.PARSED, RunState.VALIDATED, RunState.FAILED), result.transitions());
            assertInstanceOf(CyclicDependencyException.class, result.getFailure().orElseThrow());
            assertEquals(0, score.calls());
        }

        @Test
        @DisplayName("An undeclared identifier should fail the run before any task runs")
        void testUnresolvedReference() {
            RunResult result = engine.run("""
                    phenotype "Typo" version "1";
                    include NLP called N;
                    define Score: N.Score();
                    define final High: Scroe > 5;
                    """);

            assertEquals(RunState.FAILED, result.state());
            assertEquals(List.of(RunState.PARSED, RunState.VALIDATED, RunState.FAILED), result.transitions());
            UnresolvedReferenceException e = assertInstanceOf(UnresolvedReferenceException.class,
                    result.getFailure().orElseThrow());
            assertTrue(e.getMessage().contains("Scroe"));
            assertTrue(result.memberships().isEmpty());
            assertEquals(0, score.calls());
        }

        @Test
        @DisplayName("Compile should throw validation errors directly")
        void testCompileThrows() {
            assertThrows(PhenotypeValidationException.class, () -> engine.compile("""
                    phenotype "Unknown" version "1";
                    include NLP called N;
                    define A: N.Missing();
                    """));
            assertEquals(0, score.calls());
        }

        @Test
        @DisplayName("A document store outage should fail the whole run")
        void testCollaboratorOutage() {
            DocumentStore broken = mock(DocumentStore.class);
            when(broken.resolveDocumentSet(any()))
                    .thenThrow(new CollaboratorUnavailableException("document-store", "connection reset"));
            try (PhenotypeEngine failing = newEngine(broken, sink, EngineOptions.defaults())) {
                RunResult result = failing.run(THRESHOLD);

                assertEquals(RunState.FAILED, result.state());
                assertEquals(List.of(RunState.PARSED, RunState.VALIDATED, RunState.SCHEDULED,
                        RunState.EXECUTING, RunState.FAILED), result.transitions());
                assertInstanceOf(CollaboratorUnavailableException.class, result.getFailure().orElseThrow());
                assertTrue(result.memberships().isEmpty());
                assertTrue(sink.records().isEmpty());
            }
        }

        @Test
        @DisplayName("A failing sink should fail the run after aggregation")
        void testSinkFailure() {
            ResultSink failingSink = mock(ResultSink.class);
            doThrow(new IllegalStateException("disk full"))
                    .when(failingSink).publish(anyString(), anyString(), eq("p2"), anyBoolean(), anyMap());
            try (PhenotypeEngine failing = newEngine(store, failingSink, EngineOptions.defaults())) {
                RunResult result = failing.run(THRESHOLD);

                assertEquals(RunState.FAILED, result.state());
                assertEquals(RunState.AGGREGATED, result.transitions().get(result.transitions().size() - 2));
                InOrder order = inOrder(failingSink);
                order.verify(failingSink).publish(eq("Ejection"), eq("High"), eq("p1"), eq(true), anyMap());
                order.verify(failingSink).publish(eq("Ejection"), eq("High"), eq("p2"), eq(false), anyMap());
            }
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Should time runs by outcome")
        void testRunDuration() {
            SimpleMeterRegistry meters = new SimpleMeterRegistry();
            try (PhenotypeEngine metered = PhenotypeEngine.builder()
                    .taskRegistry(registry)
                    .documentStore(store)
                    .cohortResolver(cohorts)
                    .metricsService(new MicrometerMetricsService(meters))
                    .build()) {
                metered.run(THRESHOLD);
                metered.run("phenotype \"Loop\" version \"1\"; define A: B; define B: A;");
            }

            Timer complete = meters.find("phenotype.run.duration").tag("outcome", "COMPLETE").timer();
            assertNotNull(complete);
            assertEquals(1, complete.count());
            assertEquals(3.0, meters.get("phenotype.cache.miss").counter().count());
        }
    }
}
