package com.clinical.phenotype.script.ast;

import java.util.List;

/**
 * Parsed script: statements in source order.
 */
public record Script(List<Statement> statements) {

    public Script {
        statements = List.copyOf(statements);
    }

    public <T extends Statement> List<T> statementsOf(Class<T> type) {
        return statements.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
