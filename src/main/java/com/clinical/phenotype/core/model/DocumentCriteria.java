package com.clinical.phenotype.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Filter describing which documents a task should scan.
 * Keys are criteria names ({@link #REPORT_TYPES}, {@link #REPORT_TAGS}, ...); an empty map selects everything.
 */
public record DocumentCriteria(Map<String, List<String>> filters) {

    public static final String REPORT_TYPES = "report_types";
    public static final String REPORT_TAGS = "report_tags";
    public static final String PROVIDER_ROLES = "provider_roles";
    public static final String SOURCE = "source";
    public static final String FILTER_QUERY = "filter_query";

    private static final DocumentCriteria ALL = new DocumentCriteria(Map.of());

    public DocumentCriteria {
        TreeMap<String, List<String>> copy = new TreeMap<>();
        filters.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        filters = Collections.unmodifiableMap(copy);
    }

    public static DocumentCriteria all() {
        return ALL;
    }

    public static DocumentCriteria of(String key, List<String> values) {
        return new DocumentCriteria(Map.of(key, values));
    }

    public List<String> get(String key) {
        return filters.getOrDefault(key, List.of());
    }

    public boolean isUnrestricted() {
        return filters.isEmpty();
    }
}
