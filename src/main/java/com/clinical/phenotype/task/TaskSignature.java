package com.clinical.phenotype.task;

import com.clinical.phenotype.core.model.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output contract of a task, used by the binder for type inference.
 *
 * @param outputType type of every value the task produces
 * @param fields     field schema when {@code outputType} is {@link ValueType#STRUCTURED}
 */
public record TaskSignature(ValueType outputType, Map<String, ValueType> fields) {

    public TaskSignature {
        if (outputType == null || outputType == ValueType.ABSENT) {
            throw new IllegalArgumentException("outputType must be a concrete value type");
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        if (outputType != ValueType.STRUCTURED && !fields.isEmpty()) {
            throw new IllegalArgumentException("only structured outputs declare fields");
        }
    }

    public static TaskSignature bool() {
        return new TaskSignature(ValueType.BOOLEAN, Map.of());
    }

    public static TaskSignature numeric() {
        return new TaskSignature(ValueType.NUMERIC, Map.of());
    }

    public static TaskSignature string() {
        return new TaskSignature(ValueType.STRING, Map.of());
    }

    public static TaskSignature structured(Map<String, ValueType> fields) {
        return new TaskSignature(ValueType.STRUCTURED, fields);
    }
}
