package com.arbor.ast;

public final class BinaryExpression extends Expression {

    private BinaryOperator operator;

    private Expression left;

    private Expression right;

    public BinaryExpression() {
    }

    public BinaryExpression(SourceSpan span) {
        super(span);
    }

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right) {
        this.operator = operator;
        setLeft(left);
        setRight(right);
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public void setOperator(BinaryOperator operator) {
        this.operator = operator;
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = adopt(left);
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = adopt(right);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.BINARY_EXPRESSION;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onBinaryExpression(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof BinaryExpression other)) {
            return false;
        }
        if (operator != other.operator) {
            return noMatch("BinaryExpression.operator");
        }
        if (!Node.matches(left, other.left)) {
            return noMatch("BinaryExpression.left");
        }
        if (!Node.matches(right, other.right)) {
            return noMatch("BinaryExpression.right");
        }
        return true;
    }

    @Override
    public BinaryExpression cloneNode() {
        BinaryExpression clone = new BinaryExpression();
        copyBaseFieldsTo(clone);
        clone.operator = operator;
        if (left != null) {
            clone.setLeft(left.cloneNode());
        }
        if (right != null) {
            clone.setRight(right.cloneNode());
        }
        return clone;
    }

    @Override
    public boolean replace(Node existing, Node newNode) {
        if (super.replace(existing, newNode)) {
            return true;
        }
        if (left == existing) {
            setLeft((Expression) newNode);
            return true;
        }
        if (right == existing) {
            setRight((Expression) newNode);
            return true;
        }
        return false;
    }

    @Override
    public void clearTypeSystemBindings() {
        super.clearTypeSystemBindings();
        if (left != null) {
            left.clearTypeSystemBindings();
        }
        if (right != null) {
            right.clearTypeSystemBindings();
        }
    }
}
