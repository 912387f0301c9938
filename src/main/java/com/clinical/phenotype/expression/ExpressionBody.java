package com.clinical.phenotype.expression;

import com.clinical.phenotype.core.model.DefineBody;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Define body holding a bound {@code where} expression.
 */
public record ExpressionBody(BoundExpression expression) implements DefineBody {

    public ExpressionBody {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public Set<String> references() {
        Set<String> names = new LinkedHashSet<>();
        expression.collectReferences(names);
        return names;
    }
}
