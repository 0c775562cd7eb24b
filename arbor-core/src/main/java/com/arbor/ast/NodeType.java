package com.arbor.ast;

/**
 * Discriminator for the concrete node variants.
 */
public enum NodeType {
    PROGRAM("Program", Program.class),

    BLOCK_STATEMENT("BlockStatement", BlockStatement.class),
    EXPRESSION_STATEMENT("ExpressionStatement", ExpressionStatement.class),
    IF_STATEMENT("IfStatement", IfStatement.class),
    WHILE_STATEMENT("WhileStatement", WhileStatement.class),
    RETURN_STATEMENT("ReturnStatement", ReturnStatement.class),
    VARIABLE_DECLARATION("VariableDeclaration", VariableDeclaration.class),
    FUNCTION_DECLARATION("FunctionDeclaration", FunctionDeclaration.class),

    LITERAL("Literal", Literal.class),
    IDENTIFIER("Identifier", Identifier.class),
    BINARY_EXPRESSION("BinaryExpression", BinaryExpression.class),
    UNARY_EXPRESSION("UnaryExpression", UnaryExpression.class),
    CALL_EXPRESSION("CallExpression", CallExpression.class);

    private final String typeName;
    private final Class<? extends Node> nodeClass;

    NodeType(String typeName, Class<? extends Node> nodeClass) {
        this.typeName = typeName;
        this.nodeClass = nodeClass;
    }

    /**
     * The name used for this variant in persisted trees, e.g. {@code "IfStatement"}.
     */
    public String getTypeName() {
        return typeName;
    }

    public Class<? extends Node> getNodeClass() {
        return nodeClass;
    }
}
