package com.clinical.phenotype.script;

import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.SourcePosition;

/**
 * Script text does not follow the grammar. Raised before binding; nothing is executed.
 */
public class PhenotypeSyntaxException extends PhenotypeValidationException {

    private final String expected;
    private final String found;

    public PhenotypeSyntaxException(String expected, String found, SourcePosition position) {
        super("Syntax error: expected " + expected + " but found " + found, position);
        this.expected = expected;
        this.found = found;
    }

    public PhenotypeSyntaxException(String message, SourcePosition position) {
        super("Syntax error: " + message, position);
        this.expected = null;
        this.found = null;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
