package com.clinical.phenotype.binder;

import com.clinical.phenotype.core.model.PhenotypeLibrary;
import com.clinical.phenotype.graph.DependencyGraph;

import java.util.List;
import java.util.Objects;

/**
 * Validated phenotype ready for execution. Immutable and reusable across runs.
 *
 * @param library        bound declarations
 * @param graph          dependency graph over term sets, document sets, cohorts and defines
 * @param executionOrder one topological order of {@code graph}, used for plans and diagnostics
 */
public record CompiledPhenotype(PhenotypeLibrary library, DependencyGraph graph, List<String> executionOrder) {

    public CompiledPhenotype {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(graph, "graph");
        executionOrder = List.copyOf(executionOrder);
    }

    public String name() {
        return library.getName();
    }

    /**
     * Human-readable plan: one line per node in execution order with its dependencies.
     */
    public String describePlan() {
        StringBuilder sb = new StringBuilder();
        sb.append("phenotype ").append(library.getName());
        if (library.getVersion() != null) {
            sb.append(" version ").append(library.getVersion());
        }
        sb.append(" (context ").append(library.getContext().getKeyword()).append(")\n");
        int step = 1;
        for (String name : executionOrder) {
            var node = graph.node(name);
            sb.append(String.format("%3d. %-11s %s", step++, node.kind().getKeyword(), name));
            if (library.getDefines().containsKey(name) && library.getDefine(name).isFinal()) {
                sb.append(" [final]");
            }
            if (!graph.dependenciesOf(name).isEmpty()) {
                sb.append(" <- ").append(String.join(", ", graph.dependenciesOf(name)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
