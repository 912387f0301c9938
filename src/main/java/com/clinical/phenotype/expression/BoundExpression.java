package com.clinical.phenotype.expression;

import com.clinical.phenotype.core.model.SourcePosition;
import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.core.model.ValueType;
import com.clinical.phenotype.script.ast.Operator;

import java.util.Objects;
import java.util.Set;

/**
 * Type-checked expression tree. Every define reference is resolved and every node carries its
 * inferred type, so evaluation never has to re-validate.
 */
public interface BoundExpression {

    ValueType type();

    SourcePosition position();

    /**
     * Collects the define names this expression reads.
     */
    void collectReferences(Set<String> into);

    /**
     * {@code AND}, {@code OR} or {@code A NOT B}; operands are boolean or presence tests.
     */
    record Logical(Operator operator, BoundExpression left, BoundExpression right,
                   SourcePosition position) implements BoundExpression {
        public Logical {
            if (operator.category() != Operator.Category.LOGICAL) {
                throw new IllegalArgumentException("not a logical operator: " + operator);
            }
        }

        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        public void collectReferences(Set<String> into) {
            left.collectReferences(into);
            right.collectReferences(into);
        }
    }

    record Not(BoundExpression operand, SourcePosition position) implements BoundExpression {
        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        public void collectReferences(Set<String> into) {
            operand.collectReferences(into);
        }
    }

    record Comparison(Operator operator, BoundExpression left, BoundExpression right,
                      SourcePosition position) implements BoundExpression {
        public Comparison {
            if (!operator.isComparison()) {
                throw new IllegalArgumentException("not a comparison operator: " + operator);
            }
        }

        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        public void collectReferences(Set<String> into) {
            left.collectReferences(into);
            right.collectReferences(into);
        }
    }

    record Arithmetic(Operator operator, BoundExpression left, BoundExpression right,
                      SourcePosition position) implements BoundExpression {
        public Arithmetic {
            if (operator.category() != Operator.Category.ARITHMETIC) {
                throw new IllegalArgumentException("not an arithmetic operator: " + operator);
            }
        }

        @Override
        public ValueType type() {
            return ValueType.NUMERIC;
        }

        @Override
        public void collectReferences(Set<String> into) {
            left.collectReferences(into);
            right.collectReferences(into);
        }
    }

    record Negate(BoundExpression operand, SourcePosition position) implements BoundExpression {
        @Override
        public ValueType type() {
            return ValueType.NUMERIC;
        }

        @Override
        public void collectReferences(Set<String> into) {
            operand.collectReferences(into);
        }
    }

    /**
     * Reference to a define, optionally projecting one field of its values.
     *
     * @param define define name
     * @param field  projected field, or {@code null} for the whole value
     * @param type   type of the referenced values after projection
     */
    record DefineRef(String define, String field, ValueType type, SourcePosition position)
            implements BoundExpression {
        public DefineRef {
            Objects.requireNonNull(define, "define");
            Objects.requireNonNull(type, "type");
        }

        @Override
        public void collectReferences(Set<String> into) {
            into.add(define);
        }

        public String display() {
            return field == null ? define : define + "." + field;
        }
    }

    record Literal(Value value, SourcePosition position) implements BoundExpression {
        @Override
        public ValueType type() {
            return value.type();
        }

        @Override
        public void collectReferences(Set<String> into) {
        }
    }
}
