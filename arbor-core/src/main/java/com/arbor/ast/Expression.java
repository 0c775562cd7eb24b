package com.arbor.ast;

public abstract sealed class Expression extends Node
        permits Literal, Identifier, BinaryExpression, UnaryExpression, CallExpression {

    protected Expression() {
    }

    protected Expression(SourceSpan span) {
        super(span);
    }

    @Override
    public abstract Expression cloneNode();
}
