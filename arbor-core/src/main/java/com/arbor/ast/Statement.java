package com.arbor.ast;

public abstract sealed class Statement extends Node
        permits BlockStatement, ExpressionStatement, IfStatement, WhileStatement, ReturnStatement,
        VariableDeclaration, FunctionDeclaration {

    protected Statement() {
    }

    protected Statement(SourceSpan span) {
        super(span);
    }

    @Override
    public abstract Statement cloneNode();
}
