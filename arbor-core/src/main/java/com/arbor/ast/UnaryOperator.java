package com.arbor.ast;

public enum UnaryOperator {
    NEGATE("-"),
    LOGICAL_NOT("!"),
    BITWISE_NOT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
