package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.PhenotypeException;

/**
 * An external collaborator is globally unavailable. Fatal for the run that observes it.
 */
public class CollaboratorUnavailableException extends PhenotypeException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super(collaborator + " unavailable: " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(collaborator + " unavailable: " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
