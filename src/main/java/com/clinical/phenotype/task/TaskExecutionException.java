package com.clinical.phenotype.task;

import com.clinical.phenotype.core.PhenotypeException;

/**
 * Runtime failure of one define for one subject. Recorded in the run's error manifest;
 * sibling subjects and independent defines keep running.
 */
public class TaskExecutionException extends PhenotypeException {

    private final String defineName;
    private final String subjectKey;

    public TaskExecutionException(String defineName, String subjectKey, String message) {
        super(format(defineName, subjectKey, message));
        this.defineName = defineName;
        this.subjectKey = subjectKey;
    }

    public TaskExecutionException(String defineName, String subjectKey, String message, Throwable cause) {
        super(format(defineName, subjectKey, message), cause);
        this.defineName = defineName;
        this.subjectKey = subjectKey;
    }

    public String getDefineName() {
        return defineName;
    }

    public String getSubjectKey() {
        return subjectKey;
    }

    private static String format(String defineName, String subjectKey, String message) {
        return "Define '" + defineName + "' failed for subject '" + subjectKey + "': " + message;
    }
}
