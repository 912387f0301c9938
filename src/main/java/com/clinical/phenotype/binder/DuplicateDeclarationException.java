package com.clinical.phenotype.binder;

import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.SourcePosition;

/**
 * Two declarations share a name. All declaration kinds live in one namespace.
 */
public class DuplicateDeclarationException extends PhenotypeValidationException {

    private final String name;

    public DuplicateDeclarationException(String name, SourcePosition first, SourcePosition position) {
        super("Duplicate declaration of " + name + ", first declared at " + first, position);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
