package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.model.DocumentCriteria;

import java.util.stream.Stream;

/**
 * Document full-text store. The engine only resolves criteria to handles and fetches text.
 * Implementations signal a store outage with {@link CollaboratorUnavailableException}.
 */
public interface DocumentStore {

    /**
     * Resolves a document set to the handles it selects. Order should be stable across calls.
     */
    Stream<DocumentHandle> resolveDocumentSet(DocumentCriteria criteria);

    /**
     * Fetches text and metadata of one document.
     */
    Document fetchDocumentText(DocumentHandle handle);
}
