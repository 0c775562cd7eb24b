package com.arbor.ast;

public final class IfStatement extends Statement {

    private Expression test;

    private BlockStatement consequent;

    private BlockStatement alternate;  // Can be null

    public IfStatement() {
    }

    public IfStatement(SourceSpan span) {
        super(span);
    }

    public IfStatement(Expression test, BlockStatement consequent, BlockStatement alternate) {
        setTest(test);
        setConsequent(consequent);
        setAlternate(alternate);
    }

    public Expression getTest() {
        return test;
    }

    public void setTest(Expression test) {
        this.test = adopt(test);
    }

    public BlockStatement getConsequent() {
        return consequent;
    }

    public void setConsequent(BlockStatement consequent) {
        this.consequent = adopt(consequent);
    }

    public BlockStatement getAlternate() {
        return alternate;
    }

    public void setAlternate(BlockStatement alternate) {
        this.alternate = adopt(alternate);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.IF_STATEMENT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onIfStatement(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof IfStatement other)) {
            return false;
        }
        if (!Node.matches(test, other.test)) {
            return noMatch("IfStatement.test");
        }
        if (!Node.matches(consequent, other.consequent)) {
            return noMatch("IfStatement.consequent");
        }
        if (!Node.matches(alternate, other.alternate)) {
            return noMatch("IfStatement.alternate");
        }
        return true;
    }

    @Override
    public IfStatement cloneNode() {
        IfStatement clone = new IfStatement();
        copyBaseFieldsTo(clone);
        if (test != null) {
            clone.setTest(test.cloneNode());
        }
        if (consequent != null) {
            clone.setConsequent(consequent.cloneNode());
        }
        if (alternate != null) {
            clone.setAlternate(alternate.cloneNode());
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
        if (consequent == existing) {
            setConsequent((BlockStatement) newNode);
            return true;
        }
        if (alternate == existing) {
            setAlternate((BlockStatement) newNode);
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
        if (consequent != null) {
            consequent.clearTypeSystemBindings();
        }
        if (alternate != null) {
            alternate.clearTypeSystemBindings();
        }
    }
}
