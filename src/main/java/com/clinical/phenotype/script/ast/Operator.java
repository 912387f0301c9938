package com.clinical.phenotype.script.ast;

/**
 * Binary operators of the expression language.
 */
public enum Operator {
    AND("AND", Category.LOGICAL),
    OR("OR", Category.LOGICAL),
    /** {@code A NOT B}: A and not B. */
    DIFFERENCE("NOT", Category.LOGICAL),
    GREATER(">", Category.ORDERING),
    LESS("<", Category.ORDERING),
    GREATER_EQUAL(">=", Category.ORDERING),
    LESS_EQUAL("<=", Category.ORDERING),
    EQUAL("=", Category.EQUALITY),
    NOT_EQUAL("!=", Category.EQUALITY),
    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC);

    public enum Category { LOGICAL, ORDERING, EQUALITY, ARITHMETIC }

    private final String symbol;
    private final Category category;

    Operator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public boolean isComparison() {
        return category == Category.ORDERING || category == Category.EQUALITY;
    }
}
