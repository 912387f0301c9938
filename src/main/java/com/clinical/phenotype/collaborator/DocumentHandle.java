package com.clinical.phenotype.collaborator;

import java.util.Objects;

/**
 * Lightweight pointer to a document, enough to group work by subject before any text is fetched.
 */
public record DocumentHandle(String documentId, String subjectId) {

    public DocumentHandle {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(subjectId, "subjectId");
    }
}
