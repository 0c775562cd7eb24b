package com.arbor.jackson;

import com.arbor.ast.BinaryExpression;
import com.arbor.ast.BinaryOperator;
import com.arbor.ast.BlockStatement;
import com.arbor.ast.CallExpression;
import com.arbor.ast.ExpressionStatement;
import com.arbor.ast.FunctionDeclaration;
import com.arbor.ast.Identifier;
import com.arbor.ast.IfStatement;
import com.arbor.ast.Literal;
import com.arbor.ast.Program;
import com.arbor.ast.ReturnStatement;
import com.arbor.ast.UnaryExpression;
import com.arbor.ast.UnaryOperator;
import com.arbor.ast.VariableDeclaration;
import com.arbor.ast.WhileStatement;

import java.util.List;

final class SampleTrees {

    private SampleTrees() {
    }

    /**
     * <pre>
     * let limit = 10;
     * let label = "count \"up\"";
     * function step(n, by) {
     *     if (!(n < limit)) {
     *         return null;
     *     } else {
     *         return n + by * 2.5;
     *     }
     * }
     * while (true) {
     *     log(label, step(0, 1));
     * }
     * </pre>
     */
    static Program program() {
        FunctionDeclaration step = new FunctionDeclaration(new Identifier("step"),
                List.of(new Identifier("n"), new Identifier("by")),
                new BlockStatement(
                        new IfStatement(
                                new UnaryExpression(UnaryOperator.LOGICAL_NOT,
                                        new BinaryExpression(BinaryOperator.LESS_THAN, new Identifier("n"), new Identifier("limit"))),
                                new BlockStatement(new ReturnStatement(new Literal(null))),
                                new BlockStatement(new ReturnStatement(
                                        new BinaryExpression(BinaryOperator.ADD, new Identifier("n"),
                                                new BinaryExpression(BinaryOperator.MULTIPLY, new Identifier("by"), new Literal(2.5))))))));
        step.setDocumentation("Advances n.");

        WhileStatement loop = new WhileStatement(new Literal(true), new BlockStatement(
                new ExpressionStatement(new CallExpression(new Identifier("log"), List.of(
                        new Identifier("label"),
                        new CallExpression(new Identifier("step"), List.of(new Literal(0), new Literal(1))))))));

        return new Program(List.of(
                new VariableDeclaration(new Identifier("limit"), new Literal(10)),
                new VariableDeclaration(new Identifier("label"), new Literal("count \"up\"")),
                step,
                loop));
    }
}
