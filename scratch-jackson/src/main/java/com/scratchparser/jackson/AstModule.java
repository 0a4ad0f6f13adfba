package com.scratchparser.jackson;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.scratchparser.ast.*;

/**
 * Jackson module that configures serialization for the syntax tree records.
 *
 * This module handles:
 * - Polymorphic type ids via NodeMixin
 * - Operator enums written as their symbols
 * - The "super" property of ClassDecl, which cannot be a Java identifier
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.scratchparser", "scratch-jackson"));
        addSerializer(Operator.class, new OperatorSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);

        context.setMixInAnnotations(ClassDecl.class, ClassDeclMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // A renamed accessor would otherwise be written after the unrenamed ones
    @JsonPropertyOrder({"id", "super", "body"})
    private abstract static class ClassDeclMixin {
        @JsonProperty("super")
        abstract Identifier superClass();
    }
}
