package com.arbor.ast;

import java.util.List;

/**
 * Root of a compilation unit.
 */
public final class Program extends Node {

    private final NodeList<Statement> body = new NodeList<>(this, Statement.class);

    public Program() {
    }

    public Program(SourceSpan span) {
        super(span);
    }

    public Program(List<? extends Statement> body) {
        this.body.assign(body);
    }

    public NodeList<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> statements) {
        body.assign(statements);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.PROGRAM;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onProgram(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof Program other)) {
            return false;
        }
        if (!Node.allMatch(body, other.body)) {
            return noMatch("Program.body");
        }
        return true;
    }

    @Override
    public Program cloneNode() {
        Program clone = new Program();
        copyBaseFieldsTo(clone);
        clone.body.assign(body.cloneFor(clone));
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        return body.replace(existing, newNode);
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        body.clearTypeSystemBindings();
    }
}
