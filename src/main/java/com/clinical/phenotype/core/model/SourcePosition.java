package com.clinical.phenotype.core.model;

/**
 * Line and column (both 1-based) of a construct in the script text.
 */
public record SourcePosition(int line, int column) {

    public SourcePosition {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column must be >= 1");
        }
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
