package com.arbor.ast;

public final class VariableDeclaration extends Statement {

    private Identifier id;

    private Expression init;  // Can be null

    public VariableDeclaration() {
    }

    public VariableDeclaration(SourceSpan span) {
        super(span);
    }

    public VariableDeclaration(Identifier id, Expression init) {
        setId(id);
        setInit(init);
    }

    public Identifier getId() {
        return id;
    }

    public void setId(Identifier id) {
        this.id = adopt(id);
    }

    public Expression getInit() {
        return init;
    }

    public void setInit(Expression init) {
        this.init = adopt(init);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.VARIABLE_DECLARATION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onVariableDeclaration(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof VariableDeclaration other)) {
            return false;
        }
        if (!Node.matches(id, other.id)) {
            return noMatch("VariableDeclaration.id");
        }
        if (!Node.matches(init, other.init)) {
            return noMatch("VariableDeclaration.init");
        }
        return true;
    }

    @Override
    public VariableDeclaration cloneNode() {
        VariableDeclaration clone = new VariableDeclaration();
        copyBaseFieldsTo(clone);
        if (id != null) {
            clone.setId(id.cloneNode());
        }
        if (init != null) {
            clone.setInit(init.cloneNode());
        }
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        if (id == existing) {
            setId((Identifier) newNode);
            return true;
        }
        if (init == existing) {
            setInit((Expression) newNode);
            return true;
        }
        return false;
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        if (id != null) {
            id.clearTypeSystemBindings();
        }
        if (init != null) {
            init.clearTypeSystemBindings();
        }
    }
}
