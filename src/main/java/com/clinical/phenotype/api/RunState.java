package com.clinical.phenotype.api;

/**
 * Lifecycle of one run. {@link #FAILED} is reachable from {@link #PARSED} (syntax),
 * {@link #VALIDATED} (reference, cycle, type or unknown-task errors) and {@link #EXECUTING}
 * (collaborator loss or scheduler fault).
 */
public enum RunState {
    PARSED,
    VALIDATED,
    SCHEDULED,
    EXECUTING,
    AGGREGATED,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
