package com.clinical.phenotype.core.model;

import java.util.Objects;

/**
 * One value produced for one subject by one define.
 *
 * @param subjectId  patient identifier the value belongs to
 * @param documentId source document, or {@code null} for patient-level values
 * @param value      the produced value
 */
public record ExecutionResult(String subjectId, String documentId, Value value) {

    public ExecutionResult {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(value, "value");
    }

    public static ExecutionResult ofPatient(String subjectId, Value value) {
        return new ExecutionResult(subjectId, null, value);
    }

    public static ExecutionResult ofDocument(String subjectId, String documentId, Value value) {
        return new ExecutionResult(subjectId, documentId, value);
    }

    /**
     * Key under which this result is compared: the patient, or the document in document context.
     */
    public String subjectKey(ContextType context) {
        if (context == ContextType.DOCUMENT && documentId != null) {
            return documentId;
        }
        return subjectId;
    }
}
