package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.PhenotypeException;
import com.clinical.phenotype.core.model.CohortReference;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cohort resolver keyed by the first argument of the cohort reference,
 * so {@code OHDSI.getCohort(6)} looks up {@code "6"} and
 * {@code OHDSI.getCohortByName("sepsis")} looks up {@code "sepsis"}.
 */
public class InMemoryCohortResolver implements CohortResolver {

    private final Map<String, Set<String>> cohorts = new ConcurrentHashMap<>();

    public InMemoryCohortResolver register(String key, Set<String> subjectIds) {
        cohorts.put(key, Set.copyOf(subjectIds));
        return this;
    }

    @Override
    public Set<String> resolveCohort(CohortReference reference) {
        if (reference.arguments().isEmpty()) {
            throw new PhenotypeException("Cohort reference " + reference.function() + " has no key argument");
        }
        String key = reference.arguments().get(0);
        Set<String> members = cohorts.get(key);
        if (members == null) {
            throw new PhenotypeException("Unknown cohort: " + key);
        }
        return members;
    }
}
