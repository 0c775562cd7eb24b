package com.arbor.ast;

public final class WhileStatement extends Statement {

    private Expression test;

    private BlockStatement body;

    public WhileStatement() {
    }

    public WhileStatement(SourceSpan span) {
        super(span);
    }

    public WhileStatement(Expression test, BlockStatement body) {
        setTest(test);
        setBody(body);
    }

    public Expression getTest() {
        return test;
    }

    public void setTest(Expression test) {
        this.test = adopt(test);
    }

    public BlockStatement getBody() {
        return body;
    }

    public void setBody(BlockStatement body) {
        this.body = adopt(body);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.WHILE_STATEMENT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onWhileStatement(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof WhileStatement other)) {
            return false;
        }
        if (!Node.matches(test, other.test)) {
            return noMatch("WhileStatement.test");
        }
        if (!Node.matches(body, other.body)) {
            return noMatch("WhileStatement.body");
        }
        return true;
    }

    @Override
    public WhileStatement cloneNode() {
        WhileStatement clone = new WhileStatement();
        copyBaseFieldsTo(clone);
        if (test != null) {
            clone.setTest(test.cloneNode());
        }
        if (body != null) {
            clone.setBody(body.cloneNode());
        }
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        if (test == existing) {
            setTest((Expression) newNode);
            return true;
        }
        if (body == existing) {
            setBody((BlockStatement) newNode);
            return true;
        }
        return false;
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        if (test != null) {
            test.clearTypeSystemBindings();
        }
        if (body != null) {
            body.clearTypeSystemBindings();
        }
    }
}
