package com.clinical.phenotype.task;

import com.clinical.phenotype.collaborator.Document;
import com.clinical.phenotype.core.model.ContextType;
import com.clinical.phenotype.core.model.ExecutionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved inputs of one unit of work: one define, one subject.
 *
 * @param defineName  define being computed
 * @param subjectKey  patient id, or document id in document context
 * @param context     execution context of the library
 * @param parameters  parameters in plain Java form; term set references are replaced by their
 *                    terms, other references by the referenced name
 * @param termSets    materialized term sets referenced by the invocation, by name
 * @param documents   documents of this subject selected by the invocation's document sets
 * @param upstream    results of referenced defines for this subject, by define name
 */
public record TaskInput(String defineName, String subjectKey, ContextType context,
                        Map<String, Object> parameters, Map<String, Set<String>> termSets,
                        List<Document> documents, Map<String, List<ExecutionResult>> upstream) {

    public TaskInput {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        termSets = Collections.unmodifiableMap(new LinkedHashMap<>(termSets));
        documents = List.copyOf(documents);
        upstream = Collections.unmodifiableMap(new LinkedHashMap<>(upstream));
    }

    /**
     * Union of all materialized term sets, in declaration order.
     */
    public List<String> terms() {
        Set<String> all = new LinkedHashSet<>();
        termSets.values().forEach(all::addAll);
        return new ArrayList<>(all);
    }

    public Optional<Object> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public Optional<String> stringParameter(String name) {
        return parameter(name).map(Object::toString);
    }

    /**
     * Numeric parameter; numeric strings such as {@code "2"} are accepted.
     */
    public Optional<Double> numberParameter(String name) {
        return parameter(name).map(v -> {
            if (v instanceof Number n) {
                return n.doubleValue();
            }
            try {
                return Double.parseDouble(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + name + "' is not numeric: " + v, e);
            }
        });
    }

    public List<ExecutionResult> upstream(String defineName) {
        return upstream.getOrDefault(defineName, List.of());
    }
}
