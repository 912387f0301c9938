package com.clinical.phenotype.api;

import com.clinical.phenotype.aggregate.ResultAggregator;
import com.clinical.phenotype.aggregate.ResultSink;
import com.clinical.phenotype.binder.CompiledPhenotype;
import com.clinical.phenotype.binder.SymbolBinder;
import com.clinical.phenotype.cache.CacheStats;
import com.clinical.phenotype.cache.ResultCache;
import com.clinical.phenotype.cache.SingleFlightResultCache;
import com.clinical.phenotype.collaborator.CohortResolver;
import com.clinical.phenotype.collaborator.DocumentStore;
import com.clinical.phenotype.collaborator.LiteralTerminologyService;
import com.clinical.phenotype.collaborator.TerminologyService;
import com.clinical.phenotype.core.PhenotypeException;
import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.execution.RunContext;
import com.clinical.phenotype.execution.Scheduler;
import com.clinical.phenotype.logging.LogContext;
import com.clinical.phenotype.metrics.MetricsService;
import com.clinical.phenotype.metrics.NoOpMetricsService;
import com.clinical.phenotype.script.ScriptParser;
import com.clinical.phenotype.script.ast.Script;
import com.clinical.phenotype.task.TaskRegistry;
import com.clinical.phenotype.tracing.NoOpTracingService;
import com.clinical.phenotype.tracing.Span;
import com.clinical.phenotype.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for compiling and running phenotype scripts.
 *
 * <p>Usage:</p>
 * <pre>
 * try (PhenotypeEngine engine = PhenotypeEngine.builder()
 *         .taskRegistry(registry)
 *         .documentStore(store)
 *         .cohortResolver(cohorts)
 *         .build()) {
 *     RunResult result = engine.run(scriptText);
 * }
 * </pre>
 *
 * <p>The engine owns a fixed worker pool and the result cache; both are shared by all runs and
 * released by {@link #close()}. Runs are independent and may be started from several threads.</p>
 */
public class PhenotypeEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PhenotypeEngine.class);

    private final TaskRegistry registry;
    private final DocumentStore documentStore;
    private final CohortResolver cohortResolver;
    private final TerminologyService terminologyService;
    private final ResultSink resultSink;
    private final EngineOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final SingleFlightResultCache cache;
    private final ExecutorService workers;
    private final SymbolBinder binder;
    private final Scheduler scheduler = new Scheduler();
    private final ResultAggregator aggregator = new ResultAggregator();

    private PhenotypeEngine(Builder builder) {
        this.registry = builder.registry;
        this.documentStore = builder.documentStore;
        this.cohortResolver = builder.cohortResolver;
        this.terminologyService = builder.terminologyService != null
                ? builder.terminologyService : new LiteralTerminologyService();
        this.resultSink = builder.resultSink;
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        ResultCache store = builder.resultCache != null
                ? builder.resultCache : options.getCacheConfig().createStore();
        this.cache = new SingleFlightResultCache(store, metricsService);
        this.workers = Executors.newFixedThreadPool(options.getWorkerThreads(), new WorkerThreadFactory());
        this.binder = new SymbolBinder(registry);
        log.info("PhenotypeEngine initialized: workers={}, taskTimeout={}, cacheEnabled={}, catalogs={}",
                options.getWorkerThreads(), options.getTaskTimeout(), options.getCacheConfig().enabled(),
                registry.catalogNames());
    }

    /**
     * Parses and validates a script without executing anything.
     *
     * @throws PhenotypeValidationException for syntax, reference, cycle, type or unknown-task errors
     */
    public CompiledPhenotype compile(String scriptText) {
        Script script = ScriptParser.parse(scriptText);
        return binder.bind(script);
    }

    /**
     * Compiles and executes a script. Never throws for script or runtime problems; they are
     * reported through the returned {@link RunResult}.
     */
    public RunResult run(String scriptText) {
        String runId = LogContext.generateRunId();
        long started = System.nanoTime();
        List<RunState> transitions = new ArrayList<>();
        transitions.add(RunState.PARSED);
        Script script;
        try {
            script = ScriptParser.parse(scriptText);
        } catch (PhenotypeValidationException e) {
            log.warn("Run {} rejected: {}", runId, e.getMessage());
            return failed(runId, null, transitions, e, started);
        }
        transitions.add(RunState.VALIDATED);
        CompiledPhenotype compiled;
        try {
            compiled = binder.bind(script);
        } catch (PhenotypeValidationException e) {
            log.warn("Run {} rejected: {}", runId, e.getMessage());
            return failed(runId, null, transitions, e, started);
        }
        return execute(runId, compiled, transitions, started);
    }

    /**
     * Executes an already compiled phenotype.
     */
    public RunResult execute(CompiledPhenotype compiled) {
        List<RunState> transitions = new ArrayList<>(List.of(RunState.PARSED, RunState.VALIDATED));
        return execute(LogContext.generateRunId(), compiled, transitions, System.nanoTime());
    }

    private RunResult execute(String runId, CompiledPhenotype compiled, List<RunState> transitions, long started) {
        RunContext ctx = RunContext.builder()
                .runId(runId)
                .compiled(compiled)
                .registry(registry)
                .documentStore(documentStore)
                .cohortResolver(cohortResolver)
                .terminologyService(terminologyService)
                .cache(cache)
                .metrics(metricsService)
                .tracing(tracingService)
                .workers(workers)
                .taskTimeout(options.getTaskTimeout())
                .debug(options.isDebug())
                .build();
        CacheStats before = cache.getStats();

        try (LogContext lc = LogContext.forRun(runId, compiled.name());
             Span span = tracingService.startSpan(TracingService.RUN_SPAN,
                     Map.of("phenotype", compiled.name(), "runId", runId))) {
            ctx.diagnostic("Execution plan:\n{}", compiled.describePlan());
            transitions.add(RunState.SCHEDULED);
            span.addEvent(RunState.SCHEDULED.name());
            try {
                transitions.add(RunState.EXECUTING);
                span.addEvent(RunState.EXECUTING.name());
                scheduler.run(ctx);

                ResultAggregator.Aggregation aggregation = aggregator.aggregate(ctx);
                transitions.add(RunState.AGGREGATED);
                span.addEvent(RunState.AGGREGATED.name());
                if (resultSink != null) {
                    aggregator.publish(aggregation.memberships(), resultSink);
                }
                transitions.add(RunState.COMPLETE);
                span.setAttribute("memberships", aggregation.memberships().size());
                span.setAttribute("failures", aggregation.failures().size());
                span.setStatus(Span.SpanStatus.OK);

                CacheStats after = cache.getStats();
                Duration duration = Duration.ofNanos(System.nanoTime() - started);
                metricsService.recordRunDuration(compiled.name(), RunState.COMPLETE.name(), duration);
                log.info("Run {} of {} complete: memberships={} subjectFailures={} units={} durationMs={}",
                        runId, compiled.name(), aggregation.memberships().size(), aggregation.failures().size(),
                        ctx.unitsDispatched(), duration.toMillis());
                return new RunResult(runId, compiled.name(), RunState.COMPLETE, transitions,
                        aggregation.memberships(), aggregation.failures(), null, ctx.unitsDispatched(),
                        after.hitCount() - before.hitCount(), after.coalescedCount() - before.coalescedCount(),
                        duration);
            } catch (PhenotypeException e) {
                ctx.cancel();
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("Run {} of {} failed: {}", runId, compiled.name(), e.getMessage());
                return failed(runId, compiled.name(), transitions, e, started, ctx.unitsDispatched());
            } catch (RuntimeException e) {
                ctx.cancel();
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("Run {} of {} failed unexpectedly", runId, compiled.name(), e);
                return failed(runId, compiled.name(), transitions, e, started, ctx.unitsDispatched());
            }
        }
    }

    private RunResult failed(String runId, String phenotype, List<RunState> transitions, Throwable cause,
                             long started) {
        return failed(runId, phenotype, transitions, cause, started, 0);
    }

    private RunResult failed(String runId, String phenotype, List<RunState> transitions, Throwable cause,
                             long started, long unitsDispatched) {
        transitions.add(RunState.FAILED);
        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        if (phenotype != null) {
            metricsService.recordRunDuration(phenotype, RunState.FAILED.name(), duration);
        }
        return new RunResult(runId, phenotype, RunState.FAILED, transitions, List.of(), List.of(), cause,
                unitsDispatched, 0, 0, duration);
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public void invalidateCache() {
        cache.invalidateAll();
    }

    public TaskRegistry getTaskRegistry() {
        return registry;
    }

    public EngineOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "phenotype-" + pool + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private TaskRegistry registry;
        private DocumentStore documentStore;
        private CohortResolver cohortResolver;
        private TerminologyService terminologyService;
        private ResultSink resultSink;
        private EngineOptions options = EngineOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ResultCache resultCache;

        /**
         * Sets the task catalogs scripts can call. Required.
         */
        public Builder taskRegistry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the document store. Required.
         */
        public Builder documentStore(DocumentStore documentStore) {
            this.documentStore = documentStore;
            return this;
        }

        /**
         * Sets the cohort resolver. Required.
         */
        public Builder cohortResolver(CohortResolver cohortResolver) {
            this.cohortResolver = cohortResolver;
            return this;
        }

        /**
         * Sets the terminology service for coded term sets.
         * Defaults to {@link LiteralTerminologyService} if not set.
         */
        public Builder terminologyService(TerminologyService terminologyService) {
            this.terminologyService = terminologyService;
            return this;
        }

        /**
         * Sets the sink that receives membership records of complete runs.
         */
        public Builder resultSink(ResultSink resultSink) {
            this.resultSink = resultSink;
            return this;
        }

        public Builder options(EngineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom metrics service.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service.
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Sets a custom cache store. Defaults to the store described by the options' cache config.
         */
        public Builder resultCache(ResultCache resultCache) {
            this.resultCache = resultCache;
            return this;
        }

        public PhenotypeEngine build() {
            if (registry == null) {
                throw new IllegalStateException("TaskRegistry is required");
            }
            if (documentStore == null) {
                throw new IllegalStateException("DocumentStore is required");
            }
            if (cohortResolver == null) {
                throw new IllegalStateException("CohortResolver is required");
            }
            if (options == null) {
                throw new IllegalStateException("EngineOptions must not be null");
            }
            return new PhenotypeEngine(this);
        }
    }
}
