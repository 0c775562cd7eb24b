package com.arbor.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-order traversal: a node is visited, then its children left to right. Subclasses override
 * the callbacks they care about and call {@code super} to keep descending.
 */
public class DepthFirstVisitor implements AstVisitor {

    /**
     * Visits {@code node} if present.
     *
     * @return false if {@code node} was null
     */
    public boolean visit(Node node) {
        if (node == null) {
            return false;
        }
        node.accept(this);
        return true;
    }

    /**
     * Visits a snapshot of {@code nodes}, so the list may be changed by the visit.
     */
    public void visit(NodeList<? extends Node> nodes) {
        if (nodes == null) {
            return;
        }
        List<Node> snapshot = new ArrayList<>(nodes);
        for (Node node : snapshot) {
            visit(node);
        }
    }

    @Override
    public void onProgram(Program node) {
        visit(node.getBody());
    }

    @Override
    public void onBlockStatement(BlockStatement node) {
        visit(node.getBody());
    }

    @Override
    public void onExpressionStatement(ExpressionStatement node) {
        visit(node.getExpression());
    }

    @Override
    public void onIfStatement(IfStatement node) {
        visit(node.getTest());
        visit(node.getConsequent());
        visit(node.getAlternate());
    }

    @Override
    public void onWhileStatement(WhileStatement node) {
        visit(node.getTest());
        visit(node.getBody());
    }

    @Override
    public void onReturnStatement(ReturnStatement node) {
        visit(node.getArgument());
    }

    @Override
    public void onVariableDeclaration(VariableDeclaration node) {
        visit(node.getId());
        visit(node.getInit());
    }

    @Override
    public void onFunctionDeclaration(FunctionDeclaration node) {
        visit(node.getId());
        visit(node.getParams());
        visit(node.getBody());
    }

    @Override
    public void onLiteral(Literal node) {
    }

    @Override
    public void onIdentifier(Identifier node) {
    }

    @Override
    public void onBinaryExpression(BinaryExpression node) {
        visit(node.getLeft());
        visit(node.getRight());
    }

    @Override
    public void onUnaryExpression(UnaryExpression node) {
        visit(node.getArgument());
    }

    @Override
    public void onCallExpression(CallExpression node) {
        visit(node.getCallee());
        visit(node.getArguments());
    }
}
