package com.arbor.ast;

public final class ExpressionStatement extends Statement {

    private Expression expression;

    public ExpressionStatement() {
    }

    public ExpressionStatement(SourceSpan span) {
        super(span);
    }

    public ExpressionStatement(Expression expression) {
        setExpression(expression);
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = adopt(expression);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.EXPRESSION_STATEMENT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onExpressionStatement(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof ExpressionStatement other)) {
            return false;
        }
        if (!Node.matches(expression, other.expression)) {
            return noMatch("ExpressionStatement.expression");
        }
        return true;
    }

    @Override
    public ExpressionStatement cloneNode() {
        ExpressionStatement clone = new ExpressionStatement();
        copyBaseFieldsTo(clone);
        if (expression != null) {
            clone.setExpression(expression.cloneNode());
        }
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        if (expression == existing) {
            setExpression((Expression) newNode);
            return true;
        }
        return false;
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        if (expression != null) {
            expression.clearTypeSystemBindings();
        }
    }
}
