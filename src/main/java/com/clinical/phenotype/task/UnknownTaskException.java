package com.clinical.phenotype.task;

import com.clinical.phenotype.core.PhenotypeValidationException;
import com.clinical.phenotype.core.model.SourcePosition;

/**
 * A script names a task (or document set constructor) that no registered catalog provides.
 * Raised during validation so a malformed script never starts executing.
 */
public class UnknownTaskException extends PhenotypeValidationException {

    private final String taskName;

    public UnknownTaskException(String taskName, SourcePosition position) {
        super("Unknown task: " + taskName, position);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
