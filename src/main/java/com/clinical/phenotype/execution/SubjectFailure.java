package com.clinical.phenotype.execution;

import java.util.Objects;

/**
 * One define could not be computed for one subject. Reported in the run's error manifest;
 * never fatal for the run.
 *
 * @param define     define that failed
 * @param subjectKey patient id, or document id in document context
 * @param message    failure description
 * @param cause      underlying exception, {@code null} for propagated upstream failures
 */
public record SubjectFailure(String define, String subjectKey, String message, Throwable cause) {

    public SubjectFailure {
        Objects.requireNonNull(define, "define");
        Objects.requireNonNull(subjectKey, "subjectKey");
        Objects.requireNonNull(message, "message");
    }

    /**
     * A dependency of {@code define} already failed for this subject.
     */
    public static SubjectFailure upstream(String define, String subjectKey, String failedDependency) {
        return new SubjectFailure(define, subjectKey,
                "upstream define " + failedDependency + " failed for subject " + subjectKey, null);
    }

    @Override
    public String toString() {
        return define + "[" + subjectKey + "]: " + message;
    }
}
