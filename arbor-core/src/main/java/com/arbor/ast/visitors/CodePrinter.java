package com.arbor.ast.visitors;

import com.arbor.ast.BinaryExpression;
import com.arbor.ast.BlockStatement;
import com.arbor.ast.CallExpression;
import com.arbor.ast.DepthFirstVisitor;
import com.arbor.ast.Expression;
import com.arbor.ast.ExpressionStatement;
import com.arbor.ast.FunctionDeclaration;
import com.arbor.ast.Identifier;
import com.arbor.ast.IfStatement;
import com.arbor.ast.Literal;
import com.arbor.ast.Program;
import com.arbor.ast.ReturnStatement;
import com.arbor.ast.Statement;
import com.arbor.ast.UnaryExpression;
import com.arbor.ast.VariableDeclaration;
import com.arbor.ast.WhileStatement;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders a tree as brace and semicolon source text.
 *
 * <p>Each statement goes on its own line, indented by block depth. Expressions are parenthesized
 * only where operator precedence requires it.</p>
 */
public class CodePrinter extends DepthFirstVisitor {

    public static final String DEFAULT_INDENT = "    ";

    private final Appendable out;
    private final String indentText;
    private int indentLevel = 0;

    public CodePrinter(Appendable out) {
        this(out, DEFAULT_INDENT);
    }

    public CodePrinter(Appendable out, String indentText) {
        this.out = out;
        this.indentText = indentText;
    }

    // ========================================================================
    // Output helpers
    // ========================================================================

    private void write(CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void writeIndent() {
        for (int i = 0; i < indentLevel; i++) {
            write(indentText);
        }
    }

    private void newLine() {
        write("\n");
    }

    private void indent() {
        indentLevel++;
    }

    private void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    private void printBlock(BlockStatement block) {
        write("{");
        newLine();
        indent();
        if (block != null) {
            for (Statement statement : block.getBody()) {
                visit(statement);
            }
        }
        dedent();
        writeIndent();
        write("}");
    }

    private void printOperand(Expression operand, boolean parenthesize) {
        if (parenthesize) {
            write("(");
            visit(operand);
            write(")");
        } else {
            visit(operand);
        }
    }

    private static int precedenceOf(Expression expression) {
        if (expression instanceof BinaryExpression binary && binary.getOperator() != null) {
            return binary.getOperator().getPrecedence();
        }
        return Integer.MAX_VALUE;
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    // ========================================================================
    // Statements
    // ========================================================================

    @Override
    public void onProgram(Program node) {
        for (Statement statement : node.getBody()) {
            visit(statement);
        }
    }

    @Override
    public void onBlockStatement(BlockStatement node) {
        writeIndent();
        printBlock(node);
        newLine();
    }

    @Override
    public void onExpressionStatement(ExpressionStatement node) {
        writeIndent();
        visit(node.getExpression());
        write(";");
        newLine();
    }

    @Override
    public void onIfStatement(IfStatement node) {
        writeIndent();
        write("if (");
        visit(node.getTest());
        write(") ");
        printBlock(node.getConsequent());
        if (node.getAlternate() != null) {
            write(" else ");
            printBlock(node.getAlternate());
        }
        newLine();
    }

    @Override
    public void onWhileStatement(WhileStatement node) {
        writeIndent();
        write("while (");
        visit(node.getTest());
        write(") ");
        printBlock(node.getBody());
        newLine();
    }

    @Override
    public void onReturnStatement(ReturnStatement node) {
        writeIndent();
        write("return");
        if (node.getArgument() != null) {
            write(" ");
            visit(node.getArgument());
        }
        write(";");
        newLine();
    }

    @Override
    public void onVariableDeclaration(VariableDeclaration node) {
        writeIndent();
        write("let ");
        visit(node.getId());
        if (node.getInit() != null) {
            write(" = ");
            visit(node.getInit());
        }
        write(";");
        newLine();
    }

    @Override
    public void onFunctionDeclaration(FunctionDeclaration node) {
        writeIndent();
        write("function ");
        visit(node.getId());
        write("(");
        for (int i = 0; i < node.getParams().size(); i++) {
            if (i > 0) {
                write(", ");
            }
            visit(node.getParams().get(i));
        }
        write(") ");
        printBlock(node.getBody());
        newLine();
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    @Override
    public void onLiteral(Literal node) {
        Object value = node.getValue();
        if (value instanceof String s) {
            write(quote(s));
        } else {
            write(String.valueOf(value));
        }
    }

    @Override
    public void onIdentifier(Identifier node) {
        write(node.getName());
    }

    @Override
    public void onBinaryExpression(BinaryExpression node) {
        int precedence = precedenceOf(node);
        // Left-associative: an equal-precedence right operand needs parentheses, a left one does not.
        printOperand(node.getLeft(), precedenceOf(node.getLeft()) < precedence);
        write(" ");
        write(node.getOperator() == null ? "?" : node.getOperator().getSymbol());
        write(" ");
        printOperand(node.getRight(), precedenceOf(node.getRight()) <= precedence);
    }

    @Override
    public void onUnaryExpression(UnaryExpression node) {
        write(node.getOperator() == null ? "?" : node.getOperator().getSymbol());
        printOperand(node.getArgument(), node.getArgument() instanceof BinaryExpression);
    }

    @Override
    public void onCallExpression(CallExpression node) {
        Expression callee = node.getCallee();
        printOperand(callee, callee instanceof BinaryExpression || callee instanceof UnaryExpression);
        write("(");
        for (int i = 0; i < node.getArguments().size(); i++) {
            if (i > 0) {
                write(", ");
            }
            visit(node.getArguments().get(i));
        }
        write(")");
    }
}
