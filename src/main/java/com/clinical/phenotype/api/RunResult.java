package com.clinical.phenotype.api;

import com.clinical.phenotype.aggregate.PhenotypeMembership;
import com.clinical.phenotype.execution.SubjectFailure;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one run. A {@link RunState#COMPLETE} run may still carry per-subject failures;
 * a {@link RunState#FAILED} run carries its cause and no memberships.
 *
 * @param runId            correlation id, also present in the logging MDC
 * @param phenotype        phenotype name, or {@code null} when the script did not parse
 * @param state            terminal state
 * @param transitions      every state the run went through, in order
 * @param memberships      membership records in final-define order, then subject order
 * @param failures         per-subject error manifest
 * @param failure          cause when {@code state} is {@link RunState#FAILED}
 * @param unitsDispatched  task units actually executed (cache hits excluded)
 * @param cacheHits        cache hits observed during this run
 * @param cacheCoalesced   requests that joined an in-flight computation during this run
 * @param duration         wall-clock duration
 */
public record RunResult(String runId, String phenotype, RunState state, List<RunState> transitions,
                        List<PhenotypeMembership> memberships, List<SubjectFailure> failures,
                        Throwable failure, long unitsDispatched, long cacheHits, long cacheCoalesced,
                        Duration duration) {

    public RunResult {
        transitions = List.copyOf(transitions);
        memberships = List.copyOf(memberships);
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return state == RunState.COMPLETE;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public List<PhenotypeMembership> membershipsFor(String finalDefine) {
        return memberships.stream().filter(m -> m.finalDefine().equals(finalDefine)).toList();
    }

    /**
     * Membership of one subject in one final define, if reported.
     */
    public Optional<PhenotypeMembership> membership(String finalDefine, String subjectId) {
        return memberships.stream()
                .filter(m -> m.finalDefine().equals(finalDefine) && m.subjectId().equals(subjectId))
                .findFirst();
    }
}
