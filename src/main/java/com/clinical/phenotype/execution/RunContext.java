package com.clinical.phenotype.execution;

import com.clinical.phenotype.binder.CompiledPhenotype;
import com.clinical.phenotype.cache.SingleFlightResultCache;
import com.clinical.phenotype.collaborator.CohortResolver;
import com.clinical.phenotype.collaborator.Document;
import com.clinical.phenotype.collaborator.DocumentHandle;
import com.clinical.phenotype.collaborator.DocumentStore;
import com.clinical.phenotype.collaborator.TerminologyService;
import com.clinical.phenotype.core.model.ContextType;
import com.clinical.phenotype.core.model.DocumentCriteria;
import com.clinical.phenotype.expression.ExpressionEvaluator;
import com.clinical.phenotype.metrics.MetricsService;
import com.clinical.phenotype.metrics.NoOpMetricsService;
import com.clinical.phenotype.task.TaskRegistry;
import com.clinical.phenotype.tracing.NoOpTracingService;
import com.clinical.phenotype.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Everything one run needs, passed explicitly to every component: the compiled phenotype,
 * collaborator handles, the shared cache and worker pool, and the run's own mutable state
 * (leaf values, define results, cancellation flag, counters).
 *
 * <p>One instance per run. Run state is kept in concurrent maps because workers write
 * leaf and define results while the scheduler thread reads them.</p>
 */
public final class RunContext {
    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String runId;
    private final CompiledPhenotype compiled;
    private final TaskRegistry registry;
    private final DocumentStore documentStore;
    private final CohortResolver cohortResolver;
    private final TerminologyService terminologyService;
    private final SingleFlightResultCache cache;
    private final ExpressionEvaluator evaluator;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ExecutorService workers;
    private final Duration taskTimeout;
    private final boolean debug;

    private final Map<String, Set<String>> termSets = new ConcurrentHashMap<>();
    private final Map<String, List<Document>> documentSets = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> cohorts = new ConcurrentHashMap<>();
    private final Map<String, DefineResults> defineResults = new ConcurrentHashMap<>();
    private final Map<String, String> documentOwners = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicLong unitsDispatched = new AtomicLong();
    private volatile List<Document> allDocuments;

    private RunContext(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId");
        this.compiled = Objects.requireNonNull(builder.compiled, "compiled");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.documentStore = Objects.requireNonNull(builder.documentStore, "documentStore");
        this.cohortResolver = Objects.requireNonNull(builder.cohortResolver, "cohortResolver");
        this.terminologyService = Objects.requireNonNull(builder.terminologyService, "terminologyService");
        this.cache = Objects.requireNonNull(builder.cache, "cache");
        this.evaluator = builder.evaluator;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.workers = Objects.requireNonNull(builder.workers, "workers");
        this.taskTimeout = builder.taskTimeout;
        this.debug = builder.debug || compiled.library().isDebug();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String runId() {
        return runId;
    }

    public CompiledPhenotype compiled() {
        return compiled;
    }

    public ContextType contextType() {
        return compiled.library().getContext();
    }

    public TaskRegistry registry() {
        return registry;
    }

    public DocumentStore documentStore() {
        return documentStore;
    }

    public CohortResolver cohortResolver() {
        return cohortResolver;
    }

    public TerminologyService terminologyService() {
        return terminologyService;
    }

    public SingleFlightResultCache cache() {
        return cache;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public MetricsService metrics() {
        return metrics;
    }

    public TracingService tracing() {
        return tracing;
    }

    public ExecutorService workers() {
        return workers;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public boolean isDebug() {
        return debug;
    }

    // ---- leaves ----

    void putTermSet(String name, Set<String> terms) {
        termSets.put(name, Set.copyOf(terms));
    }

    public Set<String> termSet(String name) {
        return requireLeaf(termSets, name);
    }

    void putDocumentSet(String name, List<Document> documents) {
        documentSets.put(name, List.copyOf(documents));
    }

    public List<Document> documentSet(String name) {
        return requireLeaf(documentSets, name);
    }

    void putCohort(String name, Set<String> members) {
        cohorts.put(name, Set.copyOf(members));
    }

    public Set<String> cohort(String name) {
        return requireLeaf(cohorts, name);
    }

    private static <T> T requireLeaf(Map<String, T> leaves, String name) {
        T value = leaves.get(name);
        if (value == null) {
            throw new IllegalStateException("Leaf " + name + " has not been resolved");
        }
        return value;
    }

    /**
     * Resolves criteria through the document store, applying the script's {@code limit}.
     */
    List<Document> loadDocuments(DocumentCriteria criteria) {
        Stream<DocumentHandle> handles = documentStore.resolveDocumentSet(criteria);
        OptionalInt limit = compiled.library().getDocumentLimit();
        if (limit.isPresent()) {
            handles = handles.limit(limit.getAsInt());
        }
        List<Document> documents;
        try (Stream<DocumentHandle> stream = handles) {
            documents = stream.map(documentStore::fetchDocumentText).toList();
        }
        documents.forEach(d -> documentOwners.put(d.documentId(), d.subjectId()));
        return documents;
    }

    /**
     * Every document of the store, resolved at most once per run. Used by task defines that
     * name no document set.
     */
    List<Document> allDocuments() {
        List<Document> documents = allDocuments;
        if (documents == null) {
            synchronized (this) {
                documents = allDocuments;
                if (documents == null) {
                    documents = loadDocuments(DocumentCriteria.all());
                    allDocuments = documents;
                    diagnostic("Resolved unrestricted document set: {} documents", documents.size());
                }
            }
        }
        return documents;
    }

    /**
     * Patient owning a document, when the document has been loaded in this run.
     */
    public String ownerOf(String documentId) {
        return documentOwners.getOrDefault(documentId, documentId);
    }

    // ---- defines ----

    DefineResults startDefine(String define) {
        DefineResults results = new DefineResults(define);
        defineResults.put(define, results);
        return results;
    }

    public DefineResults results(String define) {
        DefineResults results = defineResults.get(define);
        if (results == null) {
            throw new IllegalStateException("Define " + define + " has not been executed");
        }
        return results;
    }

    public boolean hasResults(String define) {
        return defineResults.containsKey(define);
    }

    // ---- lifecycle ----

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.debug("run.cancelled runId={}", runId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    long recordDispatch() {
        return unitsDispatched.incrementAndGet();
    }

    public long unitsDispatched() {
        return unitsDispatched.get();
    }

    /**
     * Engine diagnostics: INFO when the script or engine enables {@code debug}, DEBUG otherwise.
     */
    public void diagnostic(String format, Object... arguments) {
        if (debug) {
            log.info(format, arguments);
        } else {
            log.debug(format, arguments);
        }
    }

    public static class Builder {
        private String runId;
        private CompiledPhenotype compiled;
        private TaskRegistry registry;
        private DocumentStore documentStore;
        private CohortResolver cohortResolver;
        private TerminologyService terminologyService;
        private SingleFlightResultCache cache;
        private ExpressionEvaluator evaluator = new ExpressionEvaluator();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private ExecutorService workers;
        private Duration taskTimeout = Duration.ofMinutes(5);
        private boolean debug;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder compiled(CompiledPhenotype compiled) {
            this.compiled = compiled;
            return this;
        }

        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder documentStore(DocumentStore documentStore) {
            this.documentStore = documentStore;
            return this;
        }

        public Builder cohortResolver(CohortResolver cohortResolver) {
            this.cohortResolver = cohortResolver;
            return this;
        }

        public Builder terminologyService(TerminologyService terminologyService) {
            this.terminologyService = terminologyService;
            return this;
        }

        public Builder cache(SingleFlightResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder evaluator(ExpressionEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder workers(ExecutorService workers) {
            this.workers = workers;
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
                throw new IllegalArgumentException("taskTimeout must be positive");
            }
            this.taskTimeout = taskTimeout;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
