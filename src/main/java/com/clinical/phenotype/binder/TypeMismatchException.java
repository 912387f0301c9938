package com.clinical.phenotype.binder;

import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.SourcePosition;

public class TypeMismatchException extends PhenotypeValidationException {

    public TypeMismatchException(String message, SourcePosition position) {
        super(message, position);
    }
}
