package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.model.ConceptExpansion;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default terminology service: every expansion argument is taken as a term on its own.
 */
public class LiteralTerminologyService implements TerminologyService {

    @Override
    public Set<String> expand(ConceptExpansion expansion) {
        return new LinkedHashSet<>(expansion.arguments());
    }
}
