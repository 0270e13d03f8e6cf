package com.arrowc.jackson;

import com.arrowc.TokenType;
import com.arrowc.ast.*;
import com.arrowc.target.*;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.util.Locale;

/**
 * Jackson module that configures serialization/deserialization for tokens and both trees.
 *
 * This module handles:
 * - Polymorphic type handling for source nodes (Program, Function, leaves)
 * - Polymorphic type handling for generated nodes (Program, FunctionExpression, ...)
 * - Lower-case token type names
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.arrowc", "arrowc-jackson"));
        addSerializer(TokenType.class, new TokenTypeSerializer());
        addDeserializer(TokenType.class, new TokenTypeDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Source tree
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Leaf.class, NodeMixin.class);
        // Concrete classes as well (mixin inheritance from interfaces may not apply to records)
        context.setMixInAnnotations(Program.class, NodeMixin.class);
        context.setMixInAnnotations(FunctionNode.class, NodeMixin.class);

        // Generated tree
        context.setMixInAnnotations(TargetNode.class, TargetNodeMixin.class);
        context.setMixInAnnotations(Argument.class, TargetNodeMixin.class);
        context.setMixInAnnotations(TargetProgram.class, TargetNodeMixin.class);
        context.setMixInAnnotations(FunctionExpression.class, TargetNodeMixin.class);
        context.setMixInAnnotations(BlockExpression.class, TargetNodeMixin.class);
        context.setMixInAnnotations(ReturnExpression.class, TargetNodeMixin.class);
    }

    // ==================== Polymorphic Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Program.class, name = "Program"),
        @JsonSubTypes.Type(value = FunctionNode.class, name = "Function"),
        @JsonSubTypes.Type(value = NumberLiteral.class, name = "NumberLiteral"),
        @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
        @JsonSubTypes.Type(value = Operator.class, name = "Operator")
    })
    private abstract static class NodeMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = TargetProgram.class, name = "Program"),
        @JsonSubTypes.Type(value = FunctionExpression.class, name = "FunctionExpression"),
        @JsonSubTypes.Type(value = BlockExpression.class, name = "BlockExpression"),
        @JsonSubTypes.Type(value = ReturnExpression.class, name = "ReturnExpression"),
        @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
        @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = OperatorLiteral.class, name = "OperatorLiteral")
    })
    private abstract static class TargetNodeMixin {
    }

    // ==================== Token Types ====================

    private static class TokenTypeSerializer extends JsonSerializer<TokenType> {
        @Override
        public void serialize(TokenType value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.name().toLowerCase(Locale.ROOT));
        }
    }

    private static class TokenTypeDeserializer extends JsonDeserializer<TokenType> {
        @Override
        public TokenType deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            if (text != null) {
                for (TokenType type : TokenType.values()) {
                    if (type.name().equalsIgnoreCase(text)) {
                        return type;
                    }
                }
            }
            return (TokenType) ctxt.handleWeirdStringValue(TokenType.class, text, "Unknown token type");
        }
    }
}
