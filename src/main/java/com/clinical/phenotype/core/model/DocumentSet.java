package com.clinical.phenotype.core.model;

/**
 * Named document filter.
 */
public record DocumentSet(String name, DocumentCriteria criteria, SourcePosition position) {
}
