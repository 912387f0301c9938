package com.clinical.phenotype.binder;

import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.SourcePosition;

/**
 * An identifier does not name a declaration, or names one declared further down the script.
 */
public class UnresolvedReferenceException extends PhenotypeValidationException {

    private final String identifier;

    public UnresolvedReferenceException(String identifier, String message, SourcePosition position) {
        super(message, position);
        this.identifier = identifier;
    }

    public static UnresolvedReferenceException undeclared(String identifier, SourcePosition position) {
        return new UnresolvedReferenceException(identifier, "Unresolved identifier: " + identifier, position);
    }

    public static UnresolvedReferenceException forward(String identifier, SourcePosition position) {
        return new UnresolvedReferenceException(identifier,
                "Identifier " + identifier + " is referenced before its declaration", position);
    }

    public String getIdentifier() {
        return identifier;
    }
}
