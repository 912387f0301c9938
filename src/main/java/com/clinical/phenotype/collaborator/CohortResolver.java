package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.model.CohortReference;

import java.util.Set;

/**
 * Resolves cohort references against an external clinical database.
 */
public interface CohortResolver {

    /**
     * Returns the subject identifiers in the cohort.
     */
    Set<String> resolveCohort(CohortReference reference);
}
