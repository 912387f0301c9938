package com.clinical.phenotype.task;

import com.clinical.phenotype.core.model.ExecutionResult;

import java.util.List;

/**
 * Capability implemented by every pluggable task: given the resolved inputs of one
 * subject, produce that subject's results.
 *
 * <p>Implementations must be idempotent for identical inputs, since results are cached by
 * input fingerprint, and thread-safe, since units for different subjects run concurrently.
 * Throwing fails only the current subject; throwing
 * {@link com.clinical.phenotype.collaborator.CollaboratorUnavailableException} fails the run.</p>
 */
public interface TaskExecutor {

    /**
     * Task name as written after the include alias, e.g. {@code ValueExtraction}.
     */
    String getName();

    TaskSignature getSignature();

    List<ExecutionResult> execute(TaskInput input) throws Exception;
}
