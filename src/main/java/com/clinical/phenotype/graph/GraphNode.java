package com.clinical.phenotype.graph;

import com.clinical.phenotype.core.model.DeclarationKind;
import com.clinical.phenotype.core.model.SourcePosition;

import java.util.Objects;

/**
 * Vertex of the dependency graph: a term set, document set, cohort or define.
 *
 * @param name     declaration name
 * @param kind     declaration kind
 * @param order    parse order, used as a stable tie-breaker
 * @param position declaration position
 */
public record GraphNode(String name, DeclarationKind kind, int order, SourcePosition position) {

    public GraphNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (!kind.isGraphNode()) {
            throw new IllegalArgumentException(kind + " declarations are not graph nodes");
        }
    }

    /**
     * Leaves are resolved through collaborators rather than computed.
     */
    public boolean isLeaf() {
        return kind != DeclarationKind.DEFINE;
    }
}
