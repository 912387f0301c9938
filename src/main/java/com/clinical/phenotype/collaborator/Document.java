package com.clinical.phenotype.collaborator;

import java.util.Map;
import java.util.Objects;

/**
 * Document text plus the metadata a document set can filter on.
 *
 * @param handle     identity of the document
 * @param reportType report type such as "Radiology Report"
 * @param text       full text
 * @param metadata   free-form metadata ({@code report_tag}, {@code provider_role}, {@code source}, ...)
 */
public record Document(DocumentHandle handle, String reportType, String text, Map<String, String> metadata) {

    public Document {
        Objects.requireNonNull(handle, "handle");
        text = text != null ? text : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public String documentId() {
        return handle.documentId();
    }

    public String subjectId() {
        return handle.subjectId();
    }
}
