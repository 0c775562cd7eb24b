package com.arbor.ast;

import com.arbor.typesystem.Entity;
import com.arbor.typesystem.EntityType;

import java.util.List;

/**
 * Shorthand constructors for building trees in tests.
 */
public final class TreeFixtures {

    private TreeFixtures() {
    }

    public static SourceSpan span(int line) {
        return SourceSpan.of("test.arb", line, 1);
    }

    public static Literal lit(Object value) {
        return new Literal(value);
    }

    public static Identifier id(String name) {
        return new Identifier(name);
    }

    public static BinaryExpression binary(BinaryOperator operator, Expression left, Expression right) {
        return new BinaryExpression(operator, left, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return binary(BinaryOperator.ADD, left, right);
    }

    public static BinaryExpression mul(Expression left, Expression right) {
        return binary(BinaryOperator.MULTIPLY, left, right);
    }

    public static CallExpression call(Expression callee, Expression... arguments) {
        return new CallExpression(callee, List.of(arguments));
    }

    public static ExpressionStatement stmt(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static BlockStatement block(Statement... statements) {
        return new BlockStatement(statements);
    }

    public static Program program(Statement... statements) {
        return new Program(List.of(statements));
    }

    public static Entity entity(String name) {
        return new TestEntity(name);
    }

    record TestEntity(String name) implements Entity {
        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getFullName() {
            return "test." + name;
        }

        @Override
        public EntityType getEntityType() {
            return EntityType.LOCAL;
        }
    }
}
