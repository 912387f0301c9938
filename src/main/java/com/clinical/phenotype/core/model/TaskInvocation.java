package com.clinical.phenotype.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Define body that calls a registered task, for example {@code Clarity.ValueExtraction({...})}.
 *
 * @param alias      include alias used in the script
 * @param catalog    library name the alias points to
 * @param taskName   task name within the catalog
 * @param parameters bound parameters keyed by name
 */
public record TaskInvocation(String alias, String catalog, String taskName,
                             Map<String, ParameterValue> parameters) implements DefineBody {

    public TaskInvocation {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String qualifiedName() {
        return catalog + "." + taskName;
    }

    @Override
    public Set<String> references() {
        Set<String> names = new LinkedHashSet<>();
        parameters.values().forEach(p -> p.collectReferences(names));
        return names;
    }

    /**
     * Names referenced under the given parameter key, in declaration order.
     */
    public List<String> referencesUnder(String key) {
        ParameterValue value = parameters.get(key);
        return value == null ? List.of() : List.copyOf(value.references());
    }
}
