package com.clinical.phenotype.core.model;

/**
 * Named cohort; membership is resolved lazily at execution time.
 */
public record Cohort(String name, CohortReference reference, SourcePosition position) {
}
