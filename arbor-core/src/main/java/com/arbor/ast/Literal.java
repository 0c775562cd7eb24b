package com.arbor.ast;

import java.util.Objects;

/**
 * A constant: a string, a boolean, a number or null.
 *
 * <p>Integral numbers are held as {@link Long} and floating point numbers as {@link Double}, so a
 * literal built from an {@code int} matches one built from a {@code long}.</p>
 */
public final class Literal extends Expression {

    private Object value;  // Can be null

    public Literal() {
    }

    public Literal(Object value) {
        setValue(value);
    }

    public Literal(SourceSpan span, Object value) {
        super(span);
        setValue(value);
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = normalize(value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.LITERAL;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.onLiteral(this);
    }

    @Override
    public boolean matches(Node node) {
        if (!(node instanceof Literal other)) {
            return false;
        }
        if (!Objects.equals(value, other.value)) {
            return noMatch("Literal.value");
        }
        return true;
    }

    @Override
    public Literal cloneNode() {
        Literal clone = new Literal();
        copyBaseFieldsTo(clone);
        clone.value = value;
        return clone;
    }
}
