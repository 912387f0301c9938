package com.clinical.phenotype.core.model;

/**
 * Tag of a {@link Value}.
 */
public enum ValueType {
    BOOLEAN,
    NUMERIC,
    STRING,
    STRUCTURED,
    ABSENT;

    /**
     * Only numeric values have a total order usable by {@code < > <= >=}.
     */
    public boolean isOrderable() {
        return this == NUMERIC;
    }
}
