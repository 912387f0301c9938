package com.clinical.phenotype.aggregate;

import com.clinical.phenotype.core.model.DeclarationKind;
import com.clinical.phenotype.core.model.Define;
import com.clinical.phenotype.core.model.PhenotypeLibrary;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.execution.DefineResults;
import com.clinical.phenotype.execution.RunContext;
import com.clinical.phenotype.execution.SubjectFailure;
import com.clinical.phenotype.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the results of final defines into membership records.
 *
 * <p>Each final define is reported on its own; several finals are never combined. A subject
 * qualifies for an expression define when the expression held, and for a task define when the
 * task produced a truthy value. Subjects whose final define failed go to the error manifest
 * instead of getting a record.</p>
 */
public class ResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    /**
     * Outcome of aggregation.
     *
     * @param memberships records in final-define order, then subject order
     * @param failures    every per-subject failure of the run, final or intermediate
     */
    public record Aggregation(List<PhenotypeMembership> memberships, List<SubjectFailure> failures) {
        public Aggregation {
            memberships = List.copyOf(memberships);
            failures = List.copyOf(failures);
        }
    }

    public Aggregation aggregate(RunContext ctx) {
        PhenotypeLibrary library = ctx.compiled().library();
        DependencyGraph graph = ctx.compiled().graph();
        List<PhenotypeMembership> memberships = new ArrayList<>();

        for (Define finalDefine : library.getFinalDefines()) {
            DefineResults results = ctx.results(finalDefine.name());
            List<String> supporting = supportingDefines(ctx, graph, finalDefine);
            for (String subject : results.subjects()) {
                if (results.hasFailed(subject)) {
                    continue;
                }
                boolean qualifies = results.values(subject).stream().anyMatch(Value::isTruthy);
                Map<String, List<Value>> values = new LinkedHashMap<>();
                for (String define : supporting) {
                    List<Value> defineValues = ctx.results(define).values(subject);
                    if (!defineValues.isEmpty()) {
                        values.put(define, defineValues);
                    }
                }
                memberships.add(new PhenotypeMembership(library.getName(), finalDefine.name(), subject,
                        qualifies, values));
            }
            log.debug("aggregate.final define={} subjects={} failures={}", finalDefine.name(),
                    results.subjects().size(), results.failures().size());
        }

        List<SubjectFailure> failures = new ArrayList<>();
        for (String name : ctx.compiled().executionOrder()) {
            if (graph.node(name).kind() == DeclarationKind.DEFINE && ctx.hasResults(name)) {
                failures.addAll(ctx.results(name).failures());
            }
        }
        if (library.getFinalDefines().isEmpty()) {
            ctx.diagnostic("Phenotype {} declares no final define; no membership produced", library.getName());
        }
        return new Aggregation(memberships, failures);
    }

    /**
     * Publishes records in order. A failing sink stops publication and propagates.
     */
    public void publish(List<PhenotypeMembership> memberships, ResultSink sink) {
        for (PhenotypeMembership membership : memberships) {
            sink.publish(membership.phenotype(), membership.finalDefine(), membership.subjectId(),
                    membership.qualifies(), membership.supportingValues());
        }
    }

    // transitive define dependencies in execution order; a task final also reports its own values
    private static List<String> supportingDefines(RunContext ctx, DependencyGraph graph, Define finalDefine) {
        Set<String> dependencies = graph.transitiveDependenciesOf(finalDefine.name());
        List<String> ordered = new ArrayList<>();
        for (String name : ctx.compiled().executionOrder()) {
            boolean isDefine = graph.node(name).kind() == DeclarationKind.DEFINE;
            if (isDefine && (dependencies.contains(name)
                    || (name.equals(finalDefine.name()) && finalDefine.isTaskInvocation()))) {
                ordered.add(name);
            }
        }
        return ordered;
    }
}
