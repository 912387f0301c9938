package com.clinical.phenotype.script.ast;

import com.clinical.phenotype.core.model.SourcePosition;

import java.util.List;

/**
 * Qualified call such as {@code Clarity.ValueExtraction({...})} or {@code OHDSI.getCohort(6)}.
 */
public record Call(String qualifier, String function, List<ParamNode> arguments, SourcePosition position) {

    public Call {
        arguments = List.copyOf(arguments);
    }

    public String display() {
        return qualifier + "." + function;
    }
}
