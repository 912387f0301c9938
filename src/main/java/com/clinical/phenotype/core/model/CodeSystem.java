package com.clinical.phenotype.core.model;

/**
 * Named code system URI.
 */
public record CodeSystem(String name, String uri, SourcePosition position) {
}
