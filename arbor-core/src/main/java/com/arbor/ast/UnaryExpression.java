package com.arbor.ast;

public final class UnaryExpression extends Expression {

    private UnaryOperator operator;

    private Expression argument;

    public UnaryExpression() {
    }

    public UnaryExpression(SourceSpan span) {
        super(span);
    }

    public UnaryExpression(UnaryOperator operator, Expression argument) {
        this.operator = operator;
        setArgument(argument);
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public void setOperator(UnaryOperator operator) {
        this.operator = operator;
    }

    public Expression getArgument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = adopt(argument);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.UNARY_EXPRESSION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onUnaryExpression(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof UnaryExpression other)) {
            return false;
        }
        if (operator != other.operator) {
            return noMatch("UnaryExpression.operator");
        }
        if (!Node.matches(argument, other.argument)) {
            return noMatch("UnaryExpression.argument");
        }
        return true;
    }

    @Override
    public UnaryExpression cloneNode() {
        UnaryExpression clone = new UnaryExpression();
        copyBaseFieldsTo(clone);
        clone.operator = operator;
        if (argument != null) {
            clone.setArgument(argument.cloneNode());
        }
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        if (argument == existing) {
            setArgument((Expression) newNode);
            return true;
        }
        return false;
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        if (argument != null) {
            argument.clearTypeSystemBindings();
        }
    }
}
