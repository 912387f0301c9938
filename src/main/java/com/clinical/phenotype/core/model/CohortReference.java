package com.clinical.phenotype.core.model;

import java.util.List;

/**
 * Reference to an externally resolved patient set, such as {@code OHDSI.getCohort(6)}.
 */
public record CohortReference(String qualifier, String function, List<String> arguments) {

    public CohortReference {
        arguments = List.copyOf(arguments);
    }
}
