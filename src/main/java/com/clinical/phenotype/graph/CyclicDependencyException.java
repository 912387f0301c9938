package com.clinical.phenotype.graph;

import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.SourcePosition;

import java.util.List;

/**
 * A define references itself, directly or through other defines.
 */
public class CyclicDependencyException extends PhenotypeValidationException {

    private final List<String> cycle;

    /**
     * @param cycle witness cycle, first element repeated at the end ({@code A, B, A})
     */
    public CyclicDependencyException(List<String> cycle, SourcePosition position) {
        super("Cyclic dependency: " + String.join(" -> ", cycle), position);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
