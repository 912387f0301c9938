package com.clinical.phenotype.script.ast;

import com.clinical.phenotype.core.model.SourcePosition;

/**
 * Unbound expression tree of a {@code where} define.
 */
public interface ExpressionNode {

    SourcePosition position();

    record Binary(Operator operator, ExpressionNode left, ExpressionNode right,
                  SourcePosition position) implements ExpressionNode {
    }

    record Not(ExpressionNode operand, SourcePosition position) implements ExpressionNode {
    }

    record Negate(ExpressionNode operand, SourcePosition position) implements ExpressionNode {
    }

    /**
     * {@code name} or {@code name.field}; {@code field} is {@code null} for a bare reference.
     */
    record Reference(String name, String field, SourcePosition position) implements ExpressionNode {
    }

    /**
     * String, Double or Boolean literal.
     */
    record Literal(Object value, SourcePosition position) implements ExpressionNode {
    }
}
