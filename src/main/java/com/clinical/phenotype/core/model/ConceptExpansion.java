package com.clinical.phenotype.core.model;

import java.util.List;

/**
 * Coded-concept expansion request behind a term set, such as {@code OHDSI.getConceptSet("...")}.
 *
 * @param qualifier code system or include alias the expansion is addressed to
 * @param uri       code system URI when the qualifier is a code system, otherwise {@code null}
 * @param function  expansion function name
 * @param arguments literal arguments in declaration order
 */
public record ConceptExpansion(String qualifier, String uri, String function, List<String> arguments) {

    public ConceptExpansion {
        arguments = List.copyOf(arguments);
    }
}
