package com.arbor.ast;

/**
 * Visitor over the node variants. Each node's {@code accept} calls the one method matching its
 * own type.
 *
 * @see DepthFirstVisitor
 * @see DepthFirstTransformer
 */
public interface AstVisitor {

    void onProgram(Program node);

    // --- Statements ---

    void onBlockStatement(BlockStatement node);

    void onExpressionStatement(ExpressionStatement node);

    void onIfStatement(IfStatement node);

    void onWhileStatement(WhileStatement node);

    void onReturnStatement(ReturnStatement node);

    void onVariableDeclaration(VariableDeclaration node);

    void onFunctionDeclaration(FunctionDeclaration node);

    // --- Expressions ---

    void onLiteral(Literal node);

    void onIdentifier(Identifier node);

    void onBinaryExpression(BinaryExpression node);

    void onUnaryExpression(UnaryExpression node);

    void onCallExpression(CallExpression node);
}
