package com.exprtree.jackson;

import com.exprtree.ast.DeclRef;
import com.exprtree.ast.Expr;
import com.exprtree.ast.ExprKind;
import com.exprtree.ast.SourceLoc;
import com.exprtree.ast.SourceRange;
import com.exprtree.types.Type;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization for expression trees.
 *
 * This module handles:
 * - The leading kind and type properties of every node, via ExprMixin
 * - Removal of the arena header from the output
 * - Compact forms for locations, ranges, types and declaration handles
 */
public class ExprModule extends SimpleModule {

    // Record components that describe storage rather than the tree
    private static final Set<String> EXCLUDED_FIELDS = Set.of("header");

    private static final List<String> LEADING_FIELDS = List.of("kind", "type");

    public ExprModule() {
        super("ExprModule", new Version(1, 0, 0, null, "com.exprtree", "exprtree-jackson"));
        addSerializer(ExprKind.class, new ExprKindSerializer());
        addSerializer(Type.class, new TypeSerializer());
        addSerializer(SourceLoc.class, new SourceLocSerializer());
        addSerializer(SourceRange.class, new SourceRangeSerializer());
        addSerializer(DeclRef.class, new DeclRefSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Expr.class, ExprMixin.class);

        // Drop the header and move kind/type to the front
        context.addBeanSerializerModifier(new ExprSerializerModifier());
    }

    // ==================== Mixins ====================

    private abstract static class ExprMixin {
        @JsonProperty("kind")
        abstract ExprKind kind();

        @JsonProperty("type")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Type getType();
    }

    // ==================== Serializer Modifier ====================

    private static class ExprSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Expr.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> ordered = new ArrayList<>(beanProperties.size());
            for (String leading : LEADING_FIELDS) {
                for (BeanPropertyWriter prop : beanProperties) {
                    if (leading.equals(prop.getName())) {
                        ordered.add(prop);
                    }
                }
            }
            for (BeanPropertyWriter prop : beanProperties) {
                if (EXCLUDED_FIELDS.contains(prop.getName()) || LEADING_FIELDS.contains(prop.getName())) {
                    continue;
                }
                ordered.add(prop);
            }
            return ordered;
        }
    }

    // ==================== Value Serializers ====================

    private static class ExprKindSerializer extends StdSerializer<ExprKind> {
        ExprKindSerializer() {
            super(ExprKind.class);
        }

        @Override
        public void serialize(ExprKind value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.getKindName());
        }
    }

    private static class TypeSerializer extends StdSerializer<Type> {
        TypeSerializer() {
            super(Type.class);
        }

        @Override
        public void serialize(Type value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.getString());
        }
    }

    private static class SourceLocSerializer extends StdSerializer<SourceLoc> {
        SourceLocSerializer() {
            super(SourceLoc.class);
        }

        @Override
        public void serialize(SourceLoc value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeLoc(value, gen);
        }
    }

    private static class SourceRangeSerializer extends StdSerializer<SourceRange> {
        SourceRangeSerializer() {
            super(SourceRange.class);
        }

        @Override
        public void serialize(SourceRange value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            writeLoc(value.start(), gen);
            writeLoc(value.end(), gen);
            gen.writeEndArray();
        }
    }

    private static class DeclRefSerializer extends StdSerializer<DeclRef> {
        DeclRefSerializer() {
            super(DeclRef.class);
        }

        @Override
        public void serialize(DeclRef value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeNumber(value.index());
        }
    }

    private static void writeLoc(SourceLoc loc, JsonGenerator gen) throws IOException {
        if (loc.isValid()) {
            gen.writeNumber(loc.offset());
        } else {
            gen.writeNull();
        }
    }
}
