package com.arbor.ast;

public final class ReturnStatement extends Statement {

    private Expression argument;  // Can be null

    public ReturnStatement() {
    }

    public ReturnStatement(SourceSpan span) {
        super(span);
    }

    public ReturnStatement(Expression argument) {
        setArgument(argument);
    }

    public Expression getArgument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = adopt(argument);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.RETURN_STATEMENT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onReturnStatement(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof ReturnStatement other)) {
            return false;
        }
        if (!Node.matches(argument, other.argument)) {
            return noMatch("ReturnStatement.argument");
        }
        return true;
    }

    @Override
    public ReturnStatement cloneNode() {
        ReturnStatement clone = new ReturnStatement();
        copyBaseFieldsTo(clone);
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
