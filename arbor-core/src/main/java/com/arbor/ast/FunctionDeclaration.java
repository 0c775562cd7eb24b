package com.arbor.ast;

import java.util.List;

public final class FunctionDeclaration extends Statement {

    private Identifier id;

    private final NodeList<Identifier> params = new NodeList<>(this, Identifier.class);

    private BlockStatement body;

    public FunctionDeclaration() {
    }

    public FunctionDeclaration(SourceSpan span) {
        super(span);
    }

    public FunctionDeclaration(Identifier id, List<Identifier> params, BlockStatement body) {
        setId(id);
        this.params.assign(params);
        setBody(body);
    }

    public Identifier getId() {
        return id;
    }

    public void setId(Identifier id) {
        this.id = adopt(id);
    }

    public NodeList<Identifier> getParams() {
        return params;
    }

    public void setParams(List<Identifier> params) {
        this.params.assign(params);
    }

    public BlockStatement getBody() {
        return body;
    }

    public void setBody(BlockStatement body) {
        this.body = adopt(body);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.FUNCTION_DECLARATION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onFunctionDeclaration(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof FunctionDeclaration other)) {
            return false;
        }
        if (!Node.matches(id, other.id)) {
            return noMatch("FunctionDeclaration.id");
        }
        if (!Node.allMatch(params, other.params)) {
            return noMatch("FunctionDeclaration.params");
        }
        if (!Node.matches(body, other.body)) {
            return noMatch("FunctionDeclaration.body");
        }
        return true;
    }

    @Override
    public FunctionDeclaration cloneNode() {
        FunctionDeclaration clone = new FunctionDeclaration();
        copyBaseFieldsTo(clone);
        if (id != null) {
            clone.setId(id.cloneNode());
        }
        clone.params.assign(params.cloneFor(clone));
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
        if (id == existing) {
            setId((Identifier) newNode);
            return true;
        }
        if (params.replace(existing, newNode)) {
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
        if (id != null) {
            id.clearTypeSystemBindings();
        }
        params.clearTypeSystemBindings();
        if (body != null) {
            body.clearTypeSystemBindings();
        }
    }
}
