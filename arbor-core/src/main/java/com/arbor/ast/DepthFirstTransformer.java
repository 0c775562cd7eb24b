package com.arbor.ast;

/**
 * Pre-order traversal that can substitute the node being visited.
 *
 * <p>Every child is visited through its slot: the result of {@link #visitNode(Node)} is written
 * back into the field or list position the child came from. Calling
 * {@link #replaceCurrentNode(Node)} from a callback (or from {@link #onNode(Node)}) changes what
 * gets written. Replacing with null clears a field slot and removes a list element.</p>
 */
public class DepthFirstTransformer implements AstVisitor {

    private Node resultingNode;

    /**
     * Visits {@code node} and returns what should occupy its slot afterwards.
     */
    public <T extends Node> T visitNode(T node) {
        if (node == null) {
            return null;
        }
        Node saved = resultingNode;
        resultingNode = node;
        try {
            onNode(node);
            @SuppressWarnings("unchecked")
            T result = (T) resultingNode;
            return result;
        } finally {
            resultingNode = saved;
        }
    }

    /**
     * Visits each element in place. Replacements are not revisited.
     */
    public <T extends Node> void visitList(NodeList<T> nodes) {
        if (nodes == null) {
            return;
        }
        for (int i = 0; i < nodes.size(); i++) {
            T item = nodes.get(i);
            T result = visitNode(item);
            if (result == item) {
                continue;
            }
            if (result == null) {
                nodes.remove(i);
                --i;
            } else {
                nodes.set(i, result);
            }
        }
    }

    /**
     * Hook invoked for every node reached through a slot. The default dispatches to the node's
     * callback.
     */
    protected void onNode(Node node) {
        node.accept(this);
    }

    protected void replaceCurrentNode(Node replacement) {
        resultingNode = replacement;
    }

    @Override
    public void onProgram(Program node) {
        visitList(node.getBody());
    }

    @Override
    public void onBlockStatement(BlockStatement node) {
        visitList(node.getBody());
    }

    @Override
    public void onExpressionStatement(ExpressionStatement node) {
        node.setExpression(visitNode(node.getExpression()));
    }

    @Override
    public void onIfStatement(IfStatement node) {
        node.setTest(visitNode(node.getTest()));
        node.setConsequent(visitNode(node.getConsequent()));
        node.setAlternate(visitNode(node.getAlternate()));
    }

    @Override
    public void onWhileStatement(WhileStatement node) {
        node.setTest(visitNode(node.getTest()));
        node.setBody(visitNode(node.getBody()));
    }

    @Override
    public void onReturnStatement(ReturnStatement node) {
        node.setArgument(visitNode(node.getArgument()));
    }

    @Override
    public void onVariableDeclaration(VariableDeclaration node) {
        node.setId(visitNode(node.getId()));
        node.setInit(visitNode(node.getInit()));
    }

    @Override
    public void onFunctionDeclaration(FunctionDeclaration node) {
        node.setId(visitNode(node.getId()));
        visitList(node.getParams());
        node.setBody(visitNode(node.getBody()));
    }

    @Override
    public void onLiteral(Literal node) {
    }

    @Override
    public void onIdentifier(Identifier node) {
    }

    @Override
    public void onBinaryExpression(BinaryExpression node) {
        node.setLeft(visitNode(node.getLeft()));
        node.setRight(visitNode(node.getRight()));
    }

    @Override
    public void onUnaryExpression(UnaryExpression node) {
        node.setArgument(visitNode(node.getArgument()));
    }

    @Override
    public void onCallExpression(CallExpression node) {
        node.setCallee(visitNode(node.getCallee()));
        visitList(node.getArguments());
    }
}
