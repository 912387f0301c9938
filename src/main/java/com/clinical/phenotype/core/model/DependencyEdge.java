package com.clinical.phenotype.core.model;

/**
 * "Consumes the result of" relation between two declarations.
 */
public record DependencyEdge(String consumer, String producer) {
}
