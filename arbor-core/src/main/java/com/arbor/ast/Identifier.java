package com.arbor.ast;

import java.util.Objects;

public final class Identifier extends Expression {

    private String name;

    public Identifier() {
    }

    public Identifier(SourceSpan span) {
        super(span);
    }

    public Identifier(String name) {
        this.name = name;
    }

    public Identifier(SourceSpan span, String name) {
        super(span);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.IDENTIFIER;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onIdentifier(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof Identifier other)) {
            return false;
        }
        if (!Objects.equals(name, other.name)) {
            return noMatch("Identifier.name");
        }
        return true;
    }

    @Override
    public Identifier cloneNode() {
        Identifier clone = new Identifier();
        copyBaseFieldsTo(clone);
        clone.name = name;
        return clone;
    }
}
