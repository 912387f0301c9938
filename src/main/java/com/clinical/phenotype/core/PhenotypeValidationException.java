package com.clinical.phenotype.core;

import com.clinical.phenotype.core.model.SourcePosition;

/**
 * Static-analysis failure raised before any task is dispatched.
 * Carries the script position of the offending construct when one is known.
 */
public class PhenotypeValidationException extends PhenotypeException {

    private final SourcePosition position;

    public PhenotypeValidationException(String message, SourcePosition position) {
        super(position != null ? message + " (" + position + ")" : message);
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
