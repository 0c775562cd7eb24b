package com.arbor.ast;

public enum BinaryOperator {
    OR("||", 5),
    AND("&&", 6),
    EQUALITY("==", 10),
    INEQUALITY("!=", 10),
    LESS_THAN("<", 11),
    LESS_THAN_OR_EQUAL("<=", 11),
    GREATER_THAN(">", 11),
    GREATER_THAN_OR_EQUAL(">=", 11),
    ADD("+", 13),
    SUBTRACT("-", 13),
    MULTIPLY("*", 14),
    DIVIDE("/", 14),
    MODULUS("%", 14);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Binding power; higher binds tighter. All binary operators are left-associative.
     */
    public int getPrecedence() {
        return precedence;
    }
}
