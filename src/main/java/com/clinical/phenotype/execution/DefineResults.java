package com.clinical.phenotype.execution;

import com.clinical.phenotype.core.model.ExecutionResult;
import com.clinical.phenotype.core.model.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outcome of one define for every subject it was computed for: result lists for subjects that
 * succeeded, a {@link SubjectFailure} for those that did not. A subject is never in both.
 * Written while the define executes and read-only once the define completes.
 */
public final class DefineResults {

    private final String define;
    private final Map<String, List<ExecutionResult>> results = new ConcurrentHashMap<>();
    private final Map<String, SubjectFailure> failures = new ConcurrentHashMap<>();

    public DefineResults(String define) {
        this.define = define;
    }

    public String define() {
        return define;
    }

    void succeed(String subjectKey, List<ExecutionResult> values) {
        failures.remove(subjectKey);
        results.merge(subjectKey, List.copyOf(values), (a, b) -> {
            List<ExecutionResult> merged = new ArrayList<>(a);
            merged.addAll(b);
            return Collections.unmodifiableList(merged);
        });
    }

    void fail(SubjectFailure failure) {
        results.remove(failure.subjectKey());
        failures.put(failure.subjectKey(), failure);
    }

    public List<ExecutionResult> results(String subjectKey) {
        return results.getOrDefault(subjectKey, List.of());
    }

    public List<Value> values(String subjectKey) {
        return results(subjectKey).stream().map(ExecutionResult::value).toList();
    }

    public Optional<SubjectFailure> failure(String subjectKey) {
        return Optional.ofNullable(failures.get(subjectKey));
    }

    public boolean hasFailed(String subjectKey) {
        return failures.containsKey(subjectKey);
    }

    /**
     * Subjects with a result or a failure, sorted.
     */
    public Set<String> subjects() {
        Set<String> all = new TreeSet<>(results.keySet());
        all.addAll(failures.keySet());
        return all;
    }

    public Set<String> succeededSubjects() {
        return new TreeSet<>(results.keySet());
    }

    public List<SubjectFailure> failures() {
        List<SubjectFailure> list = new ArrayList<>(failures.values());
        list.sort((a, b) -> a.subjectKey().compareTo(b.subjectKey()));
        return list;
    }
}
