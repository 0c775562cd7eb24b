package com.arbor.ast.visitors;

import com.arbor.ast.BinaryOperator;
import com.arbor.ast.FunctionDeclaration;
import com.arbor.ast.IfStatement;
import com.arbor.ast.Program;
import com.arbor.ast.ReturnStatement;
import com.arbor.ast.UnaryExpression;
import com.arbor.ast.UnaryOperator;
import com.arbor.ast.VariableDeclaration;
import com.arbor.ast.WhileStatement;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static com.arbor.ast.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class CodePrinterTest {

    @Test
    void testVariableDeclaration() {
        Program program = program(
                new VariableDeclaration(id("x"), add(lit(1), mul(lit(2), lit(3)))),
                new VariableDeclaration(id("y"), null));
        assertEquals("let x = 1 + 2 * 3;\nlet y;\n", program.toCodeString());
    }

    @Test
    void testParenthesesFollowPrecedence() {
        assertEquals("(1 + 2) * 3", mul(add(lit(1), lit(2)), lit(3)).toCodeString());
        assertEquals("1 - 2 - 3",
                binary(BinaryOperator.SUBTRACT, binary(BinaryOperator.SUBTRACT, lit(1), lit(2)), lit(3)).toCodeString());
        assertEquals("1 - (2 - 3)",
                binary(BinaryOperator.SUBTRACT, lit(1), binary(BinaryOperator.SUBTRACT, lit(2), lit(3))).toCodeString());
        assertEquals("a || b && c",
                binary(BinaryOperator.OR, id("a"), binary(BinaryOperator.AND, id("b"), id("c"))).toCodeString());
    }

    @Test
    void testUnaryExpressions() {
        assertEquals("-(1 + 2)", new UnaryExpression(UnaryOperator.NEGATE, add(lit(1), lit(2))).toCodeString());
        assertEquals("!x", new UnaryExpression(UnaryOperator.LOGICAL_NOT, id("x")).toCodeString());
        assertEquals("~-x", new UnaryExpression(UnaryOperator.BITWISE_NOT,
                new UnaryExpression(UnaryOperator.NEGATE, id("x"))).toCodeString());
    }

    @Test
    void testFunctionDeclaration() {
        FunctionDeclaration function = new FunctionDeclaration(id("sum"), List.of(id("a"), id("b")),
                block(new ReturnStatement(add(id("a"), id("b")))));

        String expected = """
                function sum(a, b) {
                    return a + b;
                }
                """;
        assertEquals(expected, function.toCodeString());
        assertEquals(expected, function.toString());
    }

    @Test
    void testNestedBlocksWithCustomIndent() {
        WhileStatement loop = new WhileStatement(binary(BinaryOperator.LESS_THAN, id("i"), lit(10)), block(
                new IfStatement(binary(BinaryOperator.EQUALITY, id("i"), lit(5)),
                        block(stmt(call(id("print"), lit("five")))),
                        block()),
                new ReturnStatement()));

        StringBuilder out = new StringBuilder();
        loop.accept(new CodePrinter(out, "  "));

        assertEquals("while (i < 10) {\n"
                + "  if (i == 5) {\n"
                + "    print(\"five\");\n"
                + "  } else {\n"
                + "  }\n"
                + "  return;\n"
                + "}\n", out.toString());
    }

    @Test
    void testLiterals() {
        assertEquals("null", lit(null).toCodeString());
        assertEquals("true", lit(true).toCodeString());
        assertEquals("42", lit(42).toCodeString());
        assertEquals("1.5", lit(1.5).toCodeString());
        assertEquals("\"say \\\"hi\\\"\\n\"", lit("say \"hi\"\n").toCodeString());
    }

    @Test
    void testCallWithComputedCallee() {
        assertEquals("f(1, g(x))", call(id("f"), lit(1), call(id("g"), id("x"))).toCodeString());
        assertEquals("(f + g)()", call(add(id("f"), id("g"))).toCodeString());
    }

    @Test
    void testBlockStatementOnItsOwn() {
        assertEquals("{\n    x;\n}\n", block(stmt(id("x"))).toCodeString());
    }

    @Test
    void testOutputFailureIsUnchecked() {
        Appendable broken = new Appendable() {
            @Override
            public Appendable append(CharSequence csq) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public Appendable append(CharSequence csq, int start, int end) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public Appendable append(char c) throws IOException {
                throw new IOException("closed");
            }
        };

        UncheckedIOException e = assertThrows(UncheckedIOException.class,
                () -> id("x").accept(new CodePrinter(broken)));
        assertEquals("closed", e.getCause().getMessage());
    }
}
