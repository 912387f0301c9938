package com.clinical.phenotype.execution;

import com.clinical.phenotype.binder.CompiledPhenotype;
import com.clinical.phenotype.binder.SymbolBinder;
import com.clinical.phenotype.cache.CacheConfig;
import com.clinical.phenotype.cache.SingleFlightResultCache;
import com.clinical.phenotype.collaborator.CollaboratorUnavailableException;
import com.clinical.phenotype.collaborator.DocumentStore;
import com.clinical.phenotype.collaborator.InMemoryCohortResolver;
import com.clinical.phenotype.collaborator.InMemoryDocumentStore;
import com.clinical.phenotype.collaborator.LiteralTerminologyService;
import com.clinical.phenotype.core.PhenotypeException;
import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.script.ScriptParser;
import com.clinical.phenotype.task.StubTask;
import com.clinical.phenotype.task.TaskRegistry;
import com.clinical.phenotype.task.TaskSignature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerTest {

    private static final String HEADER = """
            phenotype "Scheduling" version "1";
            include NLP called N;
            include OHDSI called OHDSI;
            """;

    private final Queue<String> invocations = new ConcurrentLinkedQueue<>();
    private final InMemoryDocumentStore store = new InMemoryDocumentStore()
            .add("d1", "p1", "Echo", "7")
            .add("d2", "p2", "Echo", "4")
            .add("d3", "p3", "Echo", "5");
    private final InMemoryCohortResolver cohorts = new InMemoryCohortResolver();
    private final CountDownLatch gate = new CountDownLatch(1);
    private final AtomicBoolean gateUsed = new AtomicBoolean();
    private ExecutorService workers;
    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(4);
        StubTask score = StubTask.numberPerDocument("Score");
        registry = TaskRegistry.builder()
                .register("NLP", new StubTask("Score", TaskSignature.numeric(), input -> {
                    invocations.add("Score:" + input.subjectKey());
                    return score.execute(input);
                }))
                .register("NLP", new StubTask("CountUpstream", TaskSignature.numeric(), input -> {
                    invocations.add("CountUpstream:" + input.subjectKey());
                    int count = input.upstream().values().stream().mapToInt(List::size).sum();
                    return List.of(ExecutionResult.ofPatient(input.subjectKey(), Value.number(count)));
                }))
                .register("NLP", new StubTask("FailOnP2", TaskSignature.numeric(), input -> {
                    if (input.subjectKey().equals("p2")) {
                        throw new IllegalStateException("cannot read note");
                    }
                    return score.execute(input);
                }))
                .register("NLP", new StubTask("SlowOnP2", TaskSignature.numeric(), input -> {
                    if (input.subjectKey().equals("p2")) {
                        Thread.sleep(2_000);
                    }
                    return score.execute(input);
                }))
                .register("NLP", new StubTask("Outage", TaskSignature.numeric(), input -> {
                    throw new CollaboratorUnavailableException("nlp-service", "connection refused");
                }))
                .register("NLP", new StubTask("Sleepy", TaskSignature.numeric(), input -> {
                    Thread.sleep(200);
                    return score.execute(input);
                }))
                .register("NLP", new StubTask("Gated", TaskSignature.numeric(), input -> {
                    if (gateUsed.compareAndSet(false, true)) {
                        gate.await(10, TimeUnit.SECONDS);
                    }
                    return score.execute(input);
                }))
                .build();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private RunContext context(String body, DocumentStore documents, Duration timeout) {
        return context("run-test", body, documents, timeout,
                new SingleFlightResultCache(CacheConfig.disabled().createStore()), workers);
    }

    private RunContext context(String runId, String body, DocumentStore documents, Duration timeout,
                               SingleFlightResultCache cache, ExecutorService pool) {
        CompiledPhenotype compiled = new SymbolBinder(registry).bind(ScriptParser.parse(HEADER + body));
        return RunContext.builder()
                .runId(runId)
                .compiled(compiled)
                .registry(registry)
                .documentStore(documents)
                .cohortResolver(cohorts)
                .terminologyService(new LiteralTerminologyService())
                .cache(cache)
                .workers(pool)
                .taskTimeout(timeout)
                .build();
    }

    private RunContext run(String body) {
        RunContext ctx = context(body, store, Duration.ofSeconds(10));
        new Scheduler().run(ctx);
        return ctx;
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Consumers should run after producers and receive their results")
        void testProducersFirst() {
            RunContext ctx = run("""
                    define Score: N.Score();
                    define Count: N.CountUpstream({source: Score});
                    """);

            List<String> calls = List.copyOf(invocations);
            int lastScore = 0;
            int firstCount = calls.size();
            for (int i = 0; i < calls.size(); i++) {
                if (calls.get(i).startsWith("Score")) {
                    lastScore = i;
                } else {
                    firstCount = Math.min(firstCount, i);
                }
            }
            assertTrue(lastScore < firstCount, "invocation order: " + calls);
            assertEquals(Set.of("p1", "p2", "p3"), ctx.results("Count").subjects());
            assertEquals(List.of(Value.number(1)), ctx.results("Count").values("p1"));
        }

        @Test
        @DisplayName("Expression defines should see every subject of their dependencies")
        void testExpressionDefine() {
            RunContext ctx = run("""
                    define Score: N.Score();
                    define High: Score > 5;
                    """);

            DefineResults high = ctx.results("High");
            assertEquals(List.of(Value.bool(true)), high.values("p1"));
            assertEquals(List.of(Value.bool(false)), high.values("p2"));
            assertEquals(List.of(Value.bool(false)), high.values("p3"));
            assertEquals(3, ctx.unitsDispatched());
        }
    }

    @Nested
    @DisplayName("Scoping")
    class ScopingTests {

        @Test
        @DisplayName("Cohort members without documents should still be evaluated")
        void testCohortUniverse() {
            cohorts.register("6", Set.of("p1", "p4"));
            RunContext ctx = run("""
                    cohort Adults: OHDSI.getCohort(6);
                    define Score: N.Score({cohort: Adults});
                    define High: Score > 5;
                    """);

            assertEquals(Set.of("p1"), ctx.results("Score").subjects());
            assertEquals(Set.of("p1", "p4"), ctx.results("High").subjects());
            assertEquals(List.of(Value.bool(false)), ctx.results("High").values("p4"));
        }

        @Test
        @DisplayName("Document context should key results by document")
        void testDocumentContext() {
            store.add("d4", "p1", "Echo", "2");
            RunContext ctx = run("""
                    context Document;
                    define Score: N.Score();
                    define High: Score > 5;
                    """);

            assertEquals(Set.of("d1", "d2", "d3", "d4"), ctx.results("High").subjects());
            assertEquals(List.of(Value.bool(true)), ctx.results("High").values("d1"));
            assertEquals(List.of(Value.bool(false)), ctx.results("High").values("d4"));
            assertEquals("p1", ctx.ownerOf("d4"));
        }

        @Test
        @DisplayName("Limit should cap the documents a set resolves to")
        void testLimit() {
            RunContext ctx = run("""
                    limit 2;
                    documentset Echo: N.createReportTypeList(["Echo"]);
                    define Score: N.Score({documentset: [Echo]});
                    """);

            assertEquals(2, ctx.documentSet("Echo").size());
            assertEquals(Set.of("p1", "p2"), ctx.results("Score").subjects());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("A failing subject should not affect other subjects")
        void testFaultIsolation() {
            RunContext ctx = run("""
                    define Score: N.FailOnP2();
                    define High: Score > 5;
                    """);

            DefineResults score = ctx.results("Score");
            assertEquals(Set.of("p1", "p3"), score.succeededSubjects());
            SubjectFailure failure = score.failure("p2").orElseThrow();
            assertTrue(failure.message().contains("cannot read note"));
            assertInstanceOf(IllegalStateException.class, failure.cause().getCause());

            DefineResults high = ctx.results("High");
            assertTrue(high.hasFailed("p2"));
            assertTrue(high.failure("p2").orElseThrow().message().contains("upstream define Score"));
            assertEquals(List.of(Value.bool(true)), high.values("p1"));
        }

        @Test
        @DisplayName("A unit over its deadline should fail only that subject")
        void testTimeout() {
            RunContext ctx = context("define Score: N.SlowOnP2();", store, Duration.ofMillis(200));
            new Scheduler().run(ctx);

            DefineResults score = ctx.results("Score");
            assertTrue(score.failure("p2").orElseThrow().message().contains("timed out"));
            assertEquals(Set.of("p1", "p3"), score.succeededSubjects());
        }

        @Test
        @DisplayName("Time spent queued behind other units should not count against the deadline")
        void testDeadlineStartsOnPickup() {
            workers.shutdownNow();
            workers = Executors.newFixedThreadPool(2);
            InMemoryDocumentStore crowded = new InMemoryDocumentStore();
            for (int i = 1; i <= 6; i++) {
                crowded.add("d" + i, "p" + i, "Echo", String.valueOf(i));
            }
            RunContext ctx = context("define Score: N.Sleepy();", crowded, Duration.ofMillis(500));
            new Scheduler().run(ctx);

            DefineResults score = ctx.results("Score");
            assertEquals(Set.of("p1", "p2", "p3", "p4", "p5", "p6"), score.succeededSubjects());
            assertEquals(List.of(Value.number(6)), score.values("p6"));
        }

        @Test
        @DisplayName("A collaborator outage in a task should fail the run")
        void testTaskOutage() {
            RunContext ctx = context("define Score: N.Outage();", store, Duration.ofSeconds(10));

            CollaboratorUnavailableException e = assertThrows(CollaboratorUnavailableException.class,
                    () -> new Scheduler().run(ctx));
            assertEquals("nlp-service", e.getCollaborator());
            assertTrue(ctx.isCancelled());
        }

        @Test
        @DisplayName("A document store outage should fail the run")
        void testStoreOutage() {
            DocumentStore broken = mock(DocumentStore.class);
            when(broken.resolveDocumentSet(any()))
                    .thenThrow(new CollaboratorUnavailableException("document-store", "timeout"));
            RunContext ctx = context("""
                    documentset Echo: N.createReportTypeList(["Echo"]);
                    define Score: N.Score({documentset: [Echo]});
                    """, broken, Duration.ofSeconds(10));

            PhenotypeException e = assertThrows(PhenotypeException.class, () -> new Scheduler().run(ctx));
            assertTrue(e.getMessage().contains("document-store"));
            assertTrue(ctx.isCancelled());
            assertFalse(ctx.hasResults("Score"));
        }
    }

    @Nested
    @DisplayName("Concurrent runs")
    class ConcurrentRunTests {

        private final SingleFlightResultCache shared = new SingleFlightResultCache(CacheConfig.defaults().createStore());
        private final ExecutorService poolA = Executors.newSingleThreadExecutor();
        private final ExecutorService poolB = Executors.newFixedThreadPool(2);
        private final ExecutorService runners = Executors.newFixedThreadPool(2);

        @AfterEach
        void shutdownPools() {
            gate.countDown();
            poolA.shutdownNow();
            poolB.shutdownNow();
            runners.shutdownNow();
        }

        @Test
        @DisplayName("Cancelling one run should not fail another run that joined its computations")
        void testCancellationStaysWithItsRun() throws Exception {
            Duration timeout = Duration.ofSeconds(10);
            RunContext first = context("run-a", "define Score: N.Gated();", store, timeout, shared, poolA);
            RunContext second = context("run-b", "define Score: N.Gated();", store, timeout, shared, poolB);

            Future<?> firstRun = runners.submit(() -> new Scheduler().run(first));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (shared.inFlightCount() < 3 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            Future<?> secondRun = runners.submit(() -> new Scheduler().run(second));
            while (shared.getStats().coalescedCount() < 3 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(3, shared.getStats().coalescedCount());

            first.cancel();
            gate.countDown();

            assertThrows(Exception.class, () -> firstRun.get(10, TimeUnit.SECONDS));
            secondRun.get(10, TimeUnit.SECONDS);
            assertFalse(second.isCancelled());
            DefineResults score = second.results("Score");
            assertEquals(Set.of("p1", "p2", "p3"), score.succeededSubjects());
            assertEquals(List.of(Value.number(5)), score.values("p3"));
        }
    }
}
