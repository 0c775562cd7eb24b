package com.arbor.jackson;

import com.arbor.ast.BinaryExpression;
import com.arbor.ast.BinaryOperator;
import com.arbor.ast.DepthFirstVisitor;
import com.arbor.ast.Expression;
import com.arbor.ast.ExpressionStatement;
import com.arbor.ast.FunctionDeclaration;
import com.arbor.ast.Identifier;
import com.arbor.ast.IfStatement;
import com.arbor.ast.Literal;
import com.arbor.ast.Node;
import com.arbor.ast.NodeType;
import com.arbor.ast.Program;
import com.arbor.ast.ReturnStatement;
import com.arbor.json.AstJsonException;
import com.arbor.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final AstJsonProvider provider = new JacksonAstJsonProvider();

    private static List<Node> leaves(Node root) {
        List<Node> leaves = new ArrayList<>();
        root.accept(new DepthFirstVisitor() {
            @Override
            public void onLiteral(Literal node) {
                leaves.add(node);
            }

            @Override
            public void onIdentifier(Identifier node) {
                leaves.add(node);
            }
        });
        return leaves;
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testRoundTripMatchesOriginal() throws Exception {
        Program original = SampleTrees.program();

        String json = provider.getSerializer().serialize(original);
        System.out.println("JSON: " + json);
        Program copy = provider.getDeserializer().deserializeProgram(json);

        assertTrue(copy.matches(original));
        assertEquals(original.toCodeString(), copy.toCodeString());
    }

    @Test
    void testRoundTripRebuildsParentLinks() throws Exception {
        Program copy = provider.getDeserializer().deserializeProgram(
                provider.getSerializer().serialize(SampleTrees.program()));

        List<Node> leaves = leaves(copy);
        assertEquals(19, leaves.size());
        for (Node leaf : leaves) {
            assertSame(copy, leaf.getAncestor(NodeType.PROGRAM), () -> "detached leaf " + leaf);
        }

        FunctionDeclaration step = (FunctionDeclaration) copy.getBody().get(2);
        assertSame(step, step.getParams().get(1).getParentNode());
        IfStatement ifStatement = (IfStatement) step.getBody().getBody().get(0);
        assertSame(ifStatement, ifStatement.getAlternate().getParentNode());
    }

    @Test
    void testSyntheticAndDocumentationSurvive() throws Exception {
        Program original = SampleTrees.program();
        original.getBody().get(0).setSynthetic(true);

        Program copy = provider.getDeserializer().deserializeProgram(
                provider.getSerializer().serializePretty(original));

        assertTrue(copy.getBody().get(0).isSynthetic());
        assertFalse(copy.getBody().get(1).isSynthetic());
        assertEquals("Advances n.", copy.getBody().get(2).getDocumentation());
    }

    @Test
    void testLiteralValuesKeepTheirKind() throws Exception {
        Program copy = provider.getDeserializer().deserializeProgram(
                provider.getSerializer().serialize(SampleTrees.program()));

        List<Object> values = new ArrayList<>();
        for (Node leaf : leaves(copy)) {
            if (leaf instanceof Literal literal) {
                values.add(literal.getValue());
            }
        }

        assertEquals(7, values.size());
        assertEquals(10L, values.get(0));
        assertEquals("count \"up\"", values.get(1));
        assertNull(values.get(2));
        assertEquals(2.5, values.get(3));
        assertEquals(true, values.get(4));
        assertEquals(0L, values.get(5));
        assertEquals(1L, values.get(6));
    }

    @Test
    void testDeserializeSubtree() throws Exception {
        String json = """
            {
              "type": "BinaryExpression",
              "operator": "*",
              "left": { "type": "Identifier", "name": "x" },
              "right": { "type": "Literal", "value": 3.0 },
              "unknownField": [1, 2]
            }
            """;

        Expression expression = provider.getDeserializer().deserialize(json, Expression.class);

        BinaryExpression product = assertInstanceOf(BinaryExpression.class, expression);
        assertEquals(BinaryOperator.MULTIPLY, product.getOperator());
        assertSame(product, product.getLeft().getParentNode());
        assertEquals(3.0, ((Literal) product.getRight()).getValue());
        assertEquals("x * 3.0", product.toCodeString());
    }

    @Test
    void testFailuresAreWrapped() {
        AstJsonException malformed = assertThrows(AstJsonException.class,
                () -> provider.getDeserializer().deserializeProgram("{ not json"));
        assertNotNull(malformed.getCause());

        assertThrows(AstJsonException.class,
                () -> provider.getDeserializer().deserialize("{\"type\":\"Bogus\"}", Expression.class));
        assertThrows(AstJsonException.class,
                () -> provider.getDeserializer().deserialize("{\"type\":\"Identifier\",\"name\":\"x\"}", Literal.class));
        assertThrows(AstJsonException.class,
                () -> provider.getDeserializer().deserializeProgram(null));
    }

    @Test
    void testEmptyReturnAndStatementRoundTrip() throws Exception {
        ReturnStatement bare = new ReturnStatement();
        ReturnStatement copy = provider.getDeserializer().deserialize(
                provider.getSerializer().serialize(bare), ReturnStatement.class);
        assertNull(copy.getArgument());

        ExpressionStatement call = new ExpressionStatement(new Identifier("go"));
        ExpressionStatement callCopy = provider.getDeserializer().deserialize(
                provider.getSerializer().serialize(call), ExpressionStatement.class);
        assertTrue(callCopy.matches(call));
    }
}
