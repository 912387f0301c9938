package com.clinical.phenotype.core;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class PhenotypeException extends RuntimeException {

    public PhenotypeException(String message) {
        super(message);
    }

    public PhenotypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
