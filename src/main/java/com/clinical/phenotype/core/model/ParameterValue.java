package com.clinical.phenotype.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bound task parameter: a literal, a resolved reference, a list or a nested object.
 */
public interface ParameterValue {

    /**
     * Collects referenced declaration names into {@code into}.
     */
    void collectReferences(Set<String> into);

    default Set<String> references() {
        Set<String> names = new LinkedHashSet<>();
        collectReferences(names);
        return names;
    }

    record Literal(Value value) implements ParameterValue {
        @Override
        public void collectReferences(Set<String> into) {
        }
    }

    record Reference(String name, DeclarationKind kind) implements ParameterValue {
        @Override
        public void collectReferences(Set<String> into) {
            into.add(name);
        }
    }

    record ListValue(List<ParameterValue> items) implements ParameterValue {
        public ListValue {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public void collectReferences(Set<String> into) {
            items.forEach(i -> i.collectReferences(into));
        }
    }

    record ObjectValue(Map<String, ParameterValue> entries) implements ParameterValue {
        public ObjectValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public void collectReferences(Set<String> into) {
            entries.values().forEach(v -> v.collectReferences(into));
        }
    }
}
