package com.clinical.phenotype.core.model;

import java.util.List;

/**
 * Named set of literal terms, or of terms produced by a coded-concept expansion.
 * Exactly one of {@code terms} (non-empty) or {@code expansion} is meaningful.
 */
public record TermSet(String name, List<String> terms, ConceptExpansion expansion, SourcePosition position) {

    public TermSet {
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    public static TermSet literal(String name, List<String> terms, SourcePosition position) {
        return new TermSet(name, terms, null, position);
    }

    public static TermSet coded(String name, ConceptExpansion expansion, SourcePosition position) {
        return new TermSet(name, List.of(), expansion, position);
    }

    public boolean isCoded() {
        return expansion != null;
    }
}
