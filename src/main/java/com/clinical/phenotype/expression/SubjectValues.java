package com.clinical.phenotype.expression;

import com.clinical.phenotype.core.model.Value;

import java.util.List;

/**
 * Candidate values of each define for the subject being evaluated.
 * A define with no result for the subject yields an empty list.
 */
@FunctionalInterface
public interface SubjectValues {

    List<Value> valuesOf(String define);
}
