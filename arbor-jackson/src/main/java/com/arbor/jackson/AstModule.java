package com.arbor.jackson;

import com.arbor.ast.BinaryOperator;
import com.arbor.ast.BlockStatement;
import com.arbor.ast.Expression;
import com.arbor.ast.IfStatement;
import com.arbor.ast.Literal;
import com.arbor.ast.Node;
import com.arbor.ast.NodeType;
import com.arbor.ast.ReturnStatement;
import com.arbor.ast.SourceSpan;
import com.arbor.ast.Statement;
import com.arbor.ast.UnaryOperator;
import com.arbor.ast.VariableDeclaration;
import com.arbor.jackson.mixins.NodeMixin;
import com.arbor.jackson.mixins.SourceSpanMixin;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the node classes.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin and one named subtype per NodeType
 * - The "loc" property, dropped from the output unless locations are requested
 * - Null optional children that are still written (if alternate, return argument, initializer)
 * - Literal values and operator symbols
 */
public class AstModule extends SimpleModule {

    private static final Logger LOG = LoggerFactory.getLogger(AstModule.class);

    // Properties left out of the output when locations are not requested
    private static final Set<String> LOCATION_FIELDS = Set.of("loc");

    private final boolean includeLocations;

    public AstModule() {
        this(false);
    }

    public AstModule(boolean includeLocations) {
        super("AstModule", new Version(1, 0, 0, null, "com.arbor", "arbor-jackson"));
        this.includeLocations = includeLocations;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        for (NodeType nodeType : NodeType.values()) {
            context.registerSubtypes(new NamedType(nodeType.getNodeClass(), nodeType.getTypeName()));
        }

        context.setMixInAnnotations(SourceSpan.class, SourceSpanMixin.class);
        context.setMixInAnnotations(SourceSpan.Position.class, SourceSpanMixin.PositionMixin.class);

        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ReturnStatementMixin.class);
        context.setMixInAnnotations(VariableDeclaration.class, VariableDeclarationMixin.class);

        context.setMixInAnnotations(BinaryOperator.class, OperatorMixin.class);
        context.setMixInAnnotations(UnaryOperator.class, OperatorMixin.class);

        if (!includeLocations) {
            context.addBeanSerializerModifier(new AstSerializerModifier());
        }
        LOG.debug("Registered {} node types, locations {}", NodeType.values().length,
                includeLocations ? "included" : "excluded");
    }

    // ==================== Mixins ====================

    private abstract static class LiteralMixin {
        @JsonSerialize(using = LiteralValueSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object getValue();
    }

    // Mixin for IfStatement - alternate should be included even when null
    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract BlockStatement getAlternate();
    }

    // Mixin for ReturnStatement - argument can be null
    private abstract static class ReturnStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression getArgument();
    }

    // Mixin for VariableDeclaration - init can be null
    private abstract static class VariableDeclarationMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression getInit();
    }

    // Operators travel as their source symbol
    private abstract static class OperatorMixin {
        @JsonValue
        abstract String getSymbol();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!LOCATION_FIELDS.contains(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }
}
