package com.clinical.phenotype.execution;

import com.clinical.phenotype.cache.Fingerprint;
import com.clinical.phenotype.collaborator.CollaboratorUnavailableException;
import com.clinical.phenotype.collaborator.Document;
import com.clinical.phenotype.core.PhenotypeException;
import com.clinical.phenotype.core.model.Cohort;
import com.clinical.phenotype.core.model.ContextType;
import com.clinical.phenotype.core.model.DeclarationKind;
import com.clinical.phenotype.core.model.Define;
import com.clinical.phenotype.core.model.DocumentSet;
import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.ParameterValue;
import com.clinical.phenotype.core.model.PhenotypeLibrary;
import com.clinical.phenotype.core.model.TaskInvocation;
import com.clinical.phenotype.core.model.TermSet;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.expression.ExpressionBody;
import com.clinical.phenotype.graph.DependencyGraph;
import com.clinical.phenotype.graph.GraphNode;
import com.clinical.phenotype.logging.LogContext;
import com.clinical.phenotype.task.TaskExecutionException;
import com.clinical.phenotype.task.TaskExecutor;
import com.clinical.phenotype.task.TaskInput;
import com.clinical.phenotype.tracing.Span;
import com.clinical.phenotype.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Walks the dependency graph of a compiled phenotype in topological order.
 *
 * <p>The calling thread owns the ready queue: a node is dispatched once every producer has
 * completed, and its work runs on the run's worker pool. Workers report back through a
 * completion queue, so only the calling thread ever touches the in-degree bookkeeping.</p>
 *
 * <p>Task defines fan out into one unit of work per subject. Each unit goes through the
 * single-flight cache under its own fingerprint and deadline. Unit failures are recorded per
 * subject and never stop the run; a failure of a collaborator or of leaf resolution does.</p>
 */
public class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private record Completion(String node, Throwable error) {
    }

    /**
     * Executes every node of the graph.
     *
     * @throws PhenotypeException if the run failed fatally; queued work is cancelled first
     */
    public void run(RunContext ctx) {
        DependencyGraph graph = ctx.compiled().graph();
        List<String> order = ctx.compiled().executionOrder();
        Map<String, Integer> remaining = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String name : order) {
            int count = graph.dependenciesOf(name).size();
            remaining.put(name, count);
            if (count == 0) {
                ready.add(name);
            }
        }

        BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        int completed = 0;
        int running = 0;
        while (completed < order.size()) {
            while (!ready.isEmpty()) {
                String name = ready.poll();
                running++;
                ctx.diagnostic("node.dispatched node={} kind={}", name, graph.node(name).kind());
                CompletableFuture<Void> work;
                try {
                    work = dispatch(ctx, graph.node(name));
                } catch (RuntimeException e) {
                    work = CompletableFuture.failedFuture(e);
                }
                work.whenComplete((v, error) -> completions.add(new Completion(name, error)));
            }
            if (running == 0) {
                throw new PhenotypeException("Scheduler stalled with " + (order.size() - completed)
                        + " nodes pending");
            }
            Completion completion;
            try {
                completion = completions.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.cancel();
                throw new PhenotypeException("Run " + ctx.runId() + " interrupted", e);
            }
            running--;
            completed++;
            if (completion.error() != null) {
                ctx.cancel();
                Throwable cause = unwrap(completion.error());
                log.error("Run {} failed at node {}: {}", ctx.runId(), completion.node(), cause.getMessage());
                if (cause instanceof PhenotypeException pe) {
                    throw pe;
                }
                throw new PhenotypeException("Node " + completion.node() + " failed: " + cause.getMessage(), cause);
            }
            for (String consumer : graph.dependentsOf(completion.node())) {
                if (remaining.merge(consumer, -1, Integer::sum) == 0) {
                    ready.add(consumer);
                }
            }
        }
    }

    private CompletableFuture<Void> dispatch(RunContext ctx, GraphNode node) {
        PhenotypeLibrary library = ctx.compiled().library();
        switch (node.kind()) {
            case TERMSET -> {
                TermSet termSet = library.getTermSets().get(node.name());
                return CompletableFuture.runAsync(() -> resolveTermSet(ctx, termSet), ctx.workers());
            }
            case DOCUMENTSET -> {
                DocumentSet documentSet = library.getDocumentSets().get(node.name());
                return CompletableFuture.runAsync(() -> resolveDocumentSet(ctx, documentSet), ctx.workers());
            }
            case COHORT -> {
                Cohort cohort = library.getCohorts().get(node.name());
                return CompletableFuture.runAsync(() -> resolveCohort(ctx, cohort), ctx.workers());
            }
            case DEFINE -> {
                Define define = library.getDefine(node.name());
                Span span = ctx.tracing().startSpan(TracingService.DEFINE_SPAN,
                        Map.of("define", define.name(), "runId", ctx.runId()));
                long started = System.nanoTime();
                CompletableFuture<Void> work = define.isTaskInvocation()
                        ? executeTaskDefine(ctx, define)
                        : CompletableFuture.runAsync(() -> evaluateExpressionDefine(ctx, define), ctx.workers());
                return work.whenComplete((v, error) -> {
                    DefineResults results = ctx.hasResults(define.name()) ? ctx.results(define.name()) : null;
                    if (results != null) {
                        span.setAttribute("subjects", results.subjects().size());
                        span.setAttribute("failures", results.failures().size());
                    }
                    if (error != null) {
                        span.recordException(unwrap(error));
                        span.setStatus(Span.SpanStatus.ERROR);
                    } else {
                        span.setStatus(Span.SpanStatus.OK);
                    }
                    span.close();
                    ctx.diagnostic("node.completed define={} elapsedMs={} subjects={}", define.name(),
                            Duration.ofNanos(System.nanoTime() - started).toMillis(),
                            results != null ? results.subjects().size() : 0);
                });
            }
            default -> throw new IllegalStateException("Not a graph node kind: " + node.kind());
        }
    }

    // ---- leaves ----

    private void resolveTermSet(RunContext ctx, TermSet termSet) {
        checkNotCancelled(ctx);
        Set<String> terms = termSet.isCoded()
                ? ctx.terminologyService().expand(termSet.expansion())
                : new LinkedHashSet<>(termSet.terms());
        ctx.putTermSet(termSet.name(), terms);
        ctx.diagnostic("termset.resolved name={} terms={}", termSet.name(), terms.size());
    }

    private void resolveDocumentSet(RunContext ctx, DocumentSet documentSet) {
        checkNotCancelled(ctx);
        List<Document> documents = ctx.loadDocuments(documentSet.criteria());
        ctx.putDocumentSet(documentSet.name(), documents);
        ctx.diagnostic("documentset.resolved name={} documents={}", documentSet.name(), documents.size());
    }

    private void resolveCohort(RunContext ctx, Cohort cohort) {
        checkNotCancelled(ctx);
        Set<String> members = ctx.cohortResolver().resolveCohort(cohort.reference());
        ctx.putCohort(cohort.name(), members);
        ctx.diagnostic("cohort.resolved name={} members={}", cohort.name(), members.size());
    }

    // ---- task defines ----

    private record Unit(String subjectKey, List<Document> documents) {
    }

    private CompletableFuture<Void> executeTaskDefine(RunContext ctx, Define define) {
        TaskInvocation invocation = define.taskInvocation();
        TaskExecutor executor = ctx.registry().require(invocation.catalog(), invocation.taskName(), define.position());
        DefineResults results = ctx.startDefine(define.name());

        return CompletableFuture.supplyAsync(() -> planUnits(ctx, define), ctx.workers())
                .thenCompose(units -> {
                    ctx.metrics().recordDefineFanOut(units.size());
                    ctx.diagnostic("define.planned define={} task={} units={}", define.name(),
                            invocation.qualifiedName(), units.size());
                    List<CompletableFuture<Void>> futures = new ArrayList<>(units.size());
                    for (Unit unit : units) {
                        futures.add(executeUnit(ctx, define, executor, unit, results));
                    }
                    return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
                });
    }

    /**
     * Groups the define's documents by subject key; subjects that only appear in upstream
     * define results get a unit without documents.
     */
    private List<Unit> planUnits(RunContext ctx, Define define) {
        checkNotCancelled(ctx);
        TaskInvocation invocation = define.taskInvocation();
        Map<String, DeclarationKind> references = referenceKinds(invocation);

        List<Document> documents = new ArrayList<>();
        boolean namedDocumentSet = false;
        for (Map.Entry<String, DeclarationKind> ref : references.entrySet()) {
            if (ref.getValue() == DeclarationKind.DOCUMENTSET) {
                namedDocumentSet = true;
                documents.addAll(ctx.documentSet(ref.getKey()));
            }
        }
        if (!namedDocumentSet) {
            documents.addAll(ctx.allDocuments());
        }

        Set<String> cohortMembers = null;
        for (Map.Entry<String, DeclarationKind> ref : references.entrySet()) {
            if (ref.getValue() == DeclarationKind.COHORT) {
                if (cohortMembers == null) {
                    cohortMembers = new TreeSet<>(ctx.cohort(ref.getKey()));
                } else {
                    cohortMembers.retainAll(ctx.cohort(ref.getKey()));
                }
            }
        }

        ContextType context = ctx.contextType();
        Map<String, Map<String, Document>> bySubject = new TreeMap<>();
        for (Document document : documents) {
            if (cohortMembers != null && !cohortMembers.contains(document.subjectId())) {
                continue;
            }
            String key = context == ContextType.DOCUMENT ? document.documentId() : document.subjectId();
            bySubject.computeIfAbsent(key, k -> new LinkedHashMap<>()).putIfAbsent(document.documentId(), document);
        }
        for (Map.Entry<String, DeclarationKind> ref : references.entrySet()) {
            if (ref.getValue() == DeclarationKind.DEFINE) {
                for (String subject : ctx.results(ref.getKey()).subjects()) {
                    if (cohortMembers == null || cohortMembers.contains(ctx.ownerOf(subject))) {
                        bySubject.computeIfAbsent(subject, k -> new LinkedHashMap<>());
                    }
                }
            }
        }

        List<Unit> units = new ArrayList<>(bySubject.size());
        bySubject.forEach((subject, docs) -> units.add(new Unit(subject, List.copyOf(docs.values()))));
        return units;
    }

    private CompletableFuture<Void> executeUnit(RunContext ctx, Define define, TaskExecutor executor,
                                                Unit unit, DefineResults results) {
        TaskInvocation invocation = define.taskInvocation();
        Map<String, List<ExecutionResult>> upstream = new LinkedHashMap<>();
        for (Map.Entry<String, DeclarationKind> ref : referenceKinds(invocation).entrySet()) {
            if (ref.getValue() != DeclarationKind.DEFINE) {
                continue;
            }
            DefineResults producer = ctx.results(ref.getKey());
            if (producer.hasFailed(unit.subjectKey())) {
                results.fail(SubjectFailure.upstream(define.name(), unit.subjectKey(), ref.getKey()));
                return CompletableFuture.completedFuture(null);
            }
            upstream.put(ref.getKey(), producer.results(unit.subjectKey()));
        }

        Map<String, Set<String>> termSets = new LinkedHashMap<>();
        for (Map.Entry<String, DeclarationKind> ref : referenceKinds(invocation).entrySet()) {
            if (ref.getValue() == DeclarationKind.TERMSET) {
                termSets.put(ref.getKey(), ctx.termSet(ref.getKey()));
            }
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        invocation.parameters().forEach((key, value) -> parameters.put(key, toJava(ctx, value)));

        TaskInput input = new TaskInput(define.name(), unit.subjectKey(), ctx.contextType(), parameters,
                termSets, unit.documents(), upstream);
        Fingerprint fingerprint = Fingerprint.of(fingerprintInput(invocation, input));

        return computeOrJoin(ctx, fingerprint, () -> invoke(ctx, define, executor, input))
                .handle((values, error) -> {
                    if (error == null) {
                        results.succeed(unit.subjectKey(), values);
                        return null;
                    }
                    Throwable cause = unwrap(error);
                    if (isFatal(cause)) {
                        throw new CompletionException(cause);
                    }
                    ctx.metrics().incrementTaskFailure(invocation.qualifiedName());
                    log.warn("Define {} failed for subject {}: {}", define.name(), unit.subjectKey(), cause.getMessage());
                    results.fail(new SubjectFailure(define.name(), unit.subjectKey(), cause.getMessage(), cause));
                    return null;
                });
    }

    /**
     * Looks up or computes one unit through the shared cache. A computation led by another run
     * that was cancelled is retried here as long as this run is still live.
     */
    private CompletableFuture<List<ExecutionResult>> computeOrJoin(
            RunContext ctx, Fingerprint fingerprint, Supplier<CompletableFuture<List<ExecutionResult>>> computation) {
        if (ctx.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Run " + ctx.runId() + " was cancelled"));
        }
        return ctx.cache()
                .getOrCompute(fingerprint, computation)
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof CancellationException && !ctx.isCancelled()) {
                        log.debug("Joined computation {} was cancelled by its run; retrying", fingerprint);
                        return computeOrJoin(ctx, fingerprint, computation);
                    }
                    return CompletableFuture.failedFuture(cause);
                });
    }

    /**
     * Runs the task on a worker. The deadline starts when the worker picks the unit up, so time
     * spent queued behind other units does not count against it.
     */
    private CompletableFuture<List<ExecutionResult>> invoke(RunContext ctx, Define define, TaskExecutor executor,
                                                            TaskInput input) {
        String taskName = define.taskInvocation().qualifiedName();
        long timeoutMs = ctx.taskTimeout().toMillis();
        CompletableFuture<Void> pickedUp = new CompletableFuture<>();
        CompletableFuture<List<ExecutionResult>> execution = CompletableFuture.supplyAsync(() -> {
                    pickedUp.complete(null);
                    checkNotCancelled(ctx);
                    ctx.recordDispatch();
                    long started = System.nanoTime();
                    try (LogContext lc = LogContext.forUnit(ctx.runId(), define.name(), input.subjectKey())) {
                        log.debug("task.dispatched task={} documents={}", taskName, input.documents().size());
                        List<ExecutionResult> produced = executor.execute(input);
                        return produced == null ? List.<ExecutionResult>of() : List.copyOf(produced);
                    } catch (CollaboratorUnavailableException | CancellationException e) {
                        throw e;
                    } catch (TaskExecutionException e) {
                        throw e;
                    } catch (Exception e) {
                        throw new TaskExecutionException(define.name(), input.subjectKey(),
                                taskName + " failed: " + e.getMessage(), e);
                    } finally {
                        ctx.metrics().recordTaskDuration(taskName, Duration.ofNanos(System.nanoTime() - started));
                    }
                }, ctx.workers());
        return pickedUp.thenCompose(v -> execution.orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        throw new TaskExecutionException(define.name(), input.subjectKey(),
                                taskName + " timed out after " + timeoutMs + " ms");
                    }
                    throw error instanceof CompletionException ce ? ce : new CompletionException(cause);
                });
    }

    /**
     * Canonical description of a unit: task, resolved parameters, subject scope and upstream values.
     */
    private static Map<String, Object> fingerprintInput(TaskInvocation invocation, TaskInput input) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("task", invocation.qualifiedName());
        canonical.put("context", input.context().name());
        canonical.put("subject", input.subjectKey());
        canonical.put("parameters", input.parameters());
        canonical.put("documents", input.documents().stream().map(Document::documentId).sorted().toList());
        Map<String, Object> upstream = new TreeMap<>();
        input.upstream().forEach((name, list) -> upstream.put(name, list.stream()
                .map(r -> {
                    Map<String, Object> entry = new TreeMap<>();
                    entry.put("subject", r.subjectId());
                    entry.put("document", r.documentId());
                    entry.put("value", r.value().toJava());
                    return entry;
                })
                .toList()));
        canonical.put("upstream", upstream);
        return canonical;
    }

    /**
     * Plain Java form of a parameter: term sets become their sorted terms, other references
     * their name.
     */
    private static Object toJava(RunContext ctx, ParameterValue value) {
        if (value instanceof ParameterValue.Literal literal) {
            return literal.value().toJava();
        }
        if (value instanceof ParameterValue.Reference ref) {
            if (ref.kind() == DeclarationKind.TERMSET) {
                return new ArrayList<>(new TreeSet<>(ctx.termSet(ref.name())));
            }
            return ref.name();
        }
        if (value instanceof ParameterValue.ListValue list) {
            List<Object> out = new ArrayList<>();
            list.items().forEach(item -> out.add(toJava(ctx, item)));
            return out;
        }
        ParameterValue.ObjectValue object = (ParameterValue.ObjectValue) value;
        Map<String, Object> out = new LinkedHashMap<>();
        object.entries().forEach((k, v) -> out.put(k, toJava(ctx, v)));
        return out;
    }

    private static Map<String, DeclarationKind> referenceKinds(TaskInvocation invocation) {
        Map<String, DeclarationKind> kinds = new LinkedHashMap<>();
        invocation.parameters().values().forEach(p -> collectKinds(p, kinds));
        return kinds;
    }

    private static void collectKinds(ParameterValue value, Map<String, DeclarationKind> into) {
        if (value instanceof ParameterValue.Reference ref) {
            into.put(ref.name(), ref.kind());
        } else if (value instanceof ParameterValue.ListValue list) {
            list.items().forEach(item -> collectKinds(item, into));
        } else if (value instanceof ParameterValue.ObjectValue object) {
            object.entries().values().forEach(v -> collectKinds(v, into));
        }
    }

    // ---- expression defines ----

    private void evaluateExpressionDefine(RunContext ctx, Define define) {
        checkNotCancelled(ctx);
        ExpressionBody body = (ExpressionBody) define.body();
        DefineResults results = ctx.startDefine(define.name());
        Set<String> direct = body.references();
        Set<String> universe = universeOf(ctx, define.name());

        try (LogContext lc = LogContext.forDefine(ctx.runId(), define.name())) {
            for (String subject : universe) {
                String failedDependency = null;
                for (String dependency : direct) {
                    if (ctx.results(dependency).hasFailed(subject)) {
                        failedDependency = dependency;
                        break;
                    }
                }
                if (failedDependency != null) {
                    results.fail(SubjectFailure.upstream(define.name(), subject, failedDependency));
                    continue;
                }
                boolean qualifies = ctx.evaluator().test(body.expression(),
                        name -> ctx.results(name).values(subject));
                Value value = Value.bool(qualifies);
                ExecutionResult result = ctx.contextType() == ContextType.DOCUMENT
                        ? ExecutionResult.ofDocument(ctx.ownerOf(subject), subject, value)
                        : ExecutionResult.ofPatient(subject, value);
                results.succeed(subject, List.of(result));
            }
            log.debug("expression.evaluated subjects={} failures={}", universe.size(), results.failures().size());
        }
    }

    /**
     * Subjects an expression define is evaluated for: every subject seen by the defines it
     * depends on, plus members of the cohorts those defines are scoped by.
     */
    static Set<String> universeOf(RunContext ctx, String defineName) {
        DependencyGraph graph = ctx.compiled().graph();
        PhenotypeLibrary library = ctx.compiled().library();
        Set<String> universe = new TreeSet<>();
        for (String dependency : graph.transitiveDependenciesOf(defineName)) {
            GraphNode node = graph.node(dependency);
            if (node.kind() != DeclarationKind.DEFINE) {
                continue;
            }
            universe.addAll(ctx.results(dependency).subjects());
            if (ctx.contextType() == ContextType.PATIENT && library.getDefine(dependency).isTaskInvocation()) {
                Collection<String> cohorts = cohortsOf(library.getDefine(dependency).taskInvocation());
                cohorts.forEach(cohort -> universe.addAll(ctx.cohort(cohort)));
            }
        }
        return universe;
    }

    private static Collection<String> cohortsOf(TaskInvocation invocation) {
        List<String> cohorts = new ArrayList<>();
        referenceKinds(invocation).forEach((name, kind) -> {
            if (kind == DeclarationKind.COHORT) {
                cohorts.add(name);
            }
        });
        return cohorts;
    }

    // ---- helpers ----

    private static void checkNotCancelled(RunContext ctx) {
        if (ctx.isCancelled()) {
            throw new CancellationException("Run " + ctx.runId() + " was cancelled");
        }
    }

    private static boolean isFatal(Throwable cause) {
        return cause instanceof CollaboratorUnavailableException || cause instanceof CancellationException;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
