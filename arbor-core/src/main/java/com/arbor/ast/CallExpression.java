package com.arbor.ast;

import java.util.List;

public final class CallExpression extends Expression {

    private Expression callee;

    private final NodeList<Expression> arguments = new NodeList<>(this, Expression.class);

    public CallExpression() {
    }

    public CallExpression(SourceSpan span) {
        super(span);
    }

    public CallExpression(Expression callee, List<? extends Expression> arguments) {
        setCallee(callee);
        this.arguments.assign(arguments);
    }

    public Expression getCallee() {
        return callee;
    }

    public void setCallee(Expression callee) {
        this.callee = adopt(callee);
    }

    public NodeList<Expression> getArguments() {
        return arguments;
    }

    public void setArguments(List<Expression> arguments) {
        this.arguments.assign(arguments);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CALL_EXPRESSION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onCallExpression(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof CallExpression other)) {
            return false;
        }
        if (!Node.matches(callee, other.callee)) {
            return noMatch("CallExpression.callee");
        }
        if (!Node.allMatch(arguments, other.arguments)) {
            return noMatch("CallExpression.arguments");
        }
        return true;
    }

    @Override
    public CallExpression cloneNode() {
        CallExpression clone = new CallExpression();
        copyBaseFieldsTo(clone);
        if (callee != null) {
            clone.setCallee(callee.cloneNode());
        }
        clone.arguments.assign(arguments.cloneFor(clone));
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        if (callee == existing) {
            setCallee((Expression) newNode);
            return true;
        }
        return arguments.replace(existing, newNode);
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        if (callee != null) {
            callee.clearTypeSystemBindings();
        }
        arguments.clearTypeSystemBindings();
    }
}
