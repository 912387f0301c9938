package com.clinical.phenotype.expression;

import com.clinical.phenotype.core.model.Value;
import com.clinical.phenotype.core.model.ValueType;
import com.clinical.phenotype.script.ast.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates bound expressions for one subject at a time.
 *
 * <p>A define reference stands for every candidate value the subject has for that define
 * (several document hits roll up to one patient). A comparison holds when some pair of
 * candidates satisfies it. A subject with no candidate, or only absent ones, does not satisfy a
 * predicate; {@code AND}/{@code OR}/{@code NOT} then combine plain booleans, so
 * {@code NOT X} holds for a subject with no value for {@code X}.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class ExpressionEvaluator {

    /**
     * Evaluates a boolean expression.
     */
    public boolean test(BoundExpression expression, SubjectValues values) {
        if (expression instanceof BoundExpression.Logical logical) {
            return switch (logical.operator()) {
                case AND -> test(logical.left(), values) && test(logical.right(), values);
                case OR -> test(logical.left(), values) || test(logical.right(), values);
                case DIFFERENCE -> test(logical.left(), values) && !test(logical.right(), values);
                default -> throw new IllegalStateException("Unexpected operator " + logical.operator());
            };
        }
        if (expression instanceof BoundExpression.Not not) {
            return !test(not.operand(), values);
        }
        if (expression instanceof BoundExpression.Comparison comparison) {
            List<Value> left = candidates(comparison.left(), values);
            List<Value> right = candidates(comparison.right(), values);
            for (Value l : left) {
                for (Value r : right) {
                    if (compare(comparison.operator(), l, r)) {
                        return true;
                    }
                }
            }
            return false;
        }
        // presence test
        for (Value candidate : candidates(expression, values)) {
            if (candidate.isTruthy()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Present candidate values of a value-producing expression.
     */
    public List<Value> candidates(BoundExpression expression, SubjectValues values) {
        if (expression instanceof BoundExpression.DefineRef ref) {
            List<Value> out = new ArrayList<>();
            for (Value v : values.valuesOf(ref.define())) {
                Value projected = ref.field() == null ? v : v.field(ref.field());
                if (projected.isPresent()) {
                    out.add(projected);
                }
            }
            return out;
        }
        if (expression instanceof BoundExpression.Literal literal) {
            return literal.value().isPresent() ? List.of(literal.value()) : List.of();
        }
        if (expression instanceof BoundExpression.Negate negate) {
            List<Value> out = new ArrayList<>();
            for (Value v : candidates(negate.operand(), values)) {
                if (v.type() == ValueType.NUMERIC) {
                    out.add(Value.number(-v.asNumber()));
                }
            }
            return out;
        }
        if (expression instanceof BoundExpression.Arithmetic arithmetic) {
            List<Value> out = new ArrayList<>();
            for (Value l : candidates(arithmetic.left(), values)) {
                for (Value r : candidates(arithmetic.right(), values)) {
                    if (l.type() == ValueType.NUMERIC && r.type() == ValueType.NUMERIC) {
                        Double result = apply(arithmetic.operator(), l.asNumber(), r.asNumber());
                        if (result != null) {
                            out.add(Value.number(result));
                        }
                    }
                }
            }
            return out;
        }
        return List.of(Value.bool(test(expression, values)));
    }

    static boolean compare(Operator operator, Value left, Value right) {
        if (operator.category() == Operator.Category.ORDERING) {
            if (left.type() != ValueType.NUMERIC || right.type() != ValueType.NUMERIC) {
                return false;
            }
            int c = Double.compare(left.asNumber(), right.asNumber());
            return switch (operator) {
                case GREATER -> c > 0;
                case LESS -> c < 0;
                case GREATER_EQUAL -> c >= 0;
                case LESS_EQUAL -> c <= 0;
                default -> throw new IllegalStateException("Unexpected operator " + operator);
            };
        }
        if (left.type() != right.type()) {
            return false;
        }
        boolean equal = left.type() == ValueType.NUMERIC
                ? Double.compare(left.asNumber(), right.asNumber()) == 0
                : left.equals(right);
        return operator == Operator.EQUAL ? equal : !equal;
    }

    // null when undefined (division by zero); the combination then yields no candidate
    private static Double apply(Operator operator, double l, double r) {
        return switch (operator) {
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            case MULTIPLY -> l * r;
            case DIVIDE -> r == 0 ? null : l / r;
            default -> throw new IllegalStateException("Unexpected operator " + operator);
        };
    }
}
