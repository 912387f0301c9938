package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.model.ConceptExpansion;

import java.util.Set;

/**
 * Expands coded concept references into the literal terms a task searches for.
 */
public interface TerminologyService {

    Set<String> expand(ConceptExpansion expansion);
}
