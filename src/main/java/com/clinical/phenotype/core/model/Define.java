package com.clinical.phenotype.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named intermediate computation.
 *
 * @param name         unique name
 * @param isFinal      whether the define determines phenotype membership
 * @param body         task invocation or expression
 * @param outputType   inferred result type
 * @param outputFields field schema when {@code outputType} is structured, otherwise empty
 * @param position     declaration position
 */
public record Define(String name, boolean isFinal, DefineBody body, ValueType outputType,
                     Map<String, ValueType> outputFields, SourcePosition position) {

    public Define {
        outputFields = outputFields == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(outputFields));
    }

    public boolean isTaskInvocation() {
        return body instanceof TaskInvocation;
    }

    public TaskInvocation taskInvocation() {
        if (!(body instanceof TaskInvocation invocation)) {
            throw new IllegalStateException("Define " + name + " is not a task invocation");
        }
        return invocation;
    }
}
