package com.arbor.ast;

import java.util.List;

public final class BlockStatement extends Statement {

    private final NodeList<Statement> body = new NodeList<>(this, Statement.class);

    public BlockStatement() {
    }

    public BlockStatement(SourceSpan span) {
        super(span);
    }

    public BlockStatement(List<? extends Statement> body) {
        this.body.assign(body);
    }

    public BlockStatement(Statement... statements) {
        this(List.of(statements));
    }

    public NodeList<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> statements) {
        body.assign(statements);
    }

    public void add(Statement statement) {
        body.add(statement);
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.BLOCK_STATEMENT;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onBlockStatement(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof BlockStatement other)) {
            return false;
        }
        if (!Node.allMatch(body, other.body)) {
            return noMatch("BlockStatement.body");
        }
        return true;
    }

    @Override
    public BlockStatement cloneNode() {
        BlockStatement clone = new BlockStatement();
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
