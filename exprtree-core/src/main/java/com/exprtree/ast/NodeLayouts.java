package com.exprtree.ast;

import com.exprtree.arena.NodeLayout;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed header layout of every expression kind, in (references, locations,
 * scalars) on top of the common base. Trailing elements are sized separately
 * by the variants that carry them.
 */
public final class NodeLayouts {

    private static final Map<ExprKind, NodeLayout> LAYOUTS = new EnumMap<>(ExprKind.class);

    static {
        for (ExprKind kind : ExprKind.values()) {
            LAYOUTS.put(kind, compute(kind));
        }
    }

    private NodeLayouts() {
    }

    public static NodeLayout forKind(ExprKind kind) {
        return LAYOUTS.get(kind);
    }

    // No default arm: a new kind must be given a layout here before it compiles.
    private static NodeLayout compute(ExprKind kind) {
        return switch (kind) {
            case INTEGER_LITERAL, FLOAT_LITERAL, STRING_LITERAL -> NodeLayout.of(1, 1, 0);
            case CHARACTER_LITERAL -> NodeLayout.of(0, 1, 1);
            case INTERPOLATED_STRING_LITERAL -> NodeLayout.of(1, 1, 1);
            case ERROR -> NodeLayout.of(0, 2, 0);
            case DECL_REF, SUPER_REF, OTHER_CONSTRUCTOR_DECL_REF -> NodeLayout.of(1, 1, 0);
            case UNRESOLVED_CONSTRUCTOR -> NodeLayout.of(1, 2, 0);
            case OVERLOADED_DECL_REF -> NodeLayout.of(1, 1, 1);
            case OVERLOADED_MEMBER_REF -> NodeLayout.of(2, 2, 1);
            case UNRESOLVED_DECL_REF -> NodeLayout.of(1, 1, 0);
            case UNRESOLVED_IF, UNRESOLVED_ELSE -> NodeLayout.of(0, 1, 0);
            case UNRESOLVED_SPECIALIZE -> NodeLayout.of(2, 2, 1);
            case MEMBER_REF, EXISTENTIAL_MEMBER_REF, ARCHETYPE_MEMBER_REF -> NodeLayout.of(2, 2, 0);
            case GENERIC_MEMBER_REF -> NodeLayout.of(3, 2, 1);
            case UNRESOLVED_MEMBER -> NodeLayout.of(1, 2, 0);
            case PAREN -> NodeLayout.of(1, 2, 1);
            case TUPLE -> NodeLayout.of(2, 2, 2);
            case ARRAY, DICTIONARY -> NodeLayout.of(1, 2, 0);
            case SUBSCRIPT, EXISTENTIAL_SUBSCRIPT, ARCHETYPE_SUBSCRIPT -> NodeLayout.of(3, 0, 0);
            case GENERIC_SUBSCRIPT -> NodeLayout.of(4, 0, 1);
            case UNRESOLVED_DOT -> NodeLayout.of(2, 2, 0);
            case MODULE -> NodeLayout.of(0, 1, 0);
            case TUPLE_ELEMENT -> NodeLayout.of(1, 2, 1);
            case TUPLE_SHUFFLE, SPECIALIZE -> NodeLayout.of(2, 0, 1);
            case FUNCTION_CONVERSION, ERASURE, LOAD, MATERIALIZE, REQUALIFY, METATYPE_CONVERSION,
                DERIVED_TO_BASE, ARCHETYPE_TO_SUPER, BRIDGE_TO_BLOCK -> NodeLayout.of(1, 0, 0);
            case SCALAR_TO_TUPLE -> NodeLayout.of(1, 0, 1);
            case ADDRESS_OF -> NodeLayout.of(1, 1, 0);
            case SEQUENCE -> NodeLayout.of(0, 0, 1);
            case FUNC -> NodeLayout.of(3, 3, 2);
            case PIPE_CLOSURE -> NodeLayout.of(3, 0, 3);
            case IMPLICIT_CLOSURE -> NodeLayout.of(3, 0, 2);
            case NEW_ARRAY -> NodeLayout.of(2, 3, 1);
            case METATYPE -> NodeLayout.of(1, 1, 0);
            case OPAQUE_VALUE, ZERO_VALUE -> NodeLayout.of(0, 1, 0);
            case CALL, PREFIX_UNARY, POSTFIX_UNARY, BINARY, CONSTRUCTOR_REF_CALL -> NodeLayout.of(2, 0, 1);
            case DOT_SYNTAX_CALL -> NodeLayout.of(2, 1, 1);
            case DOT_SYNTAX_BASE_IGNORED -> NodeLayout.of(2, 1, 0);
            case COERCE, UNCHECKED_DOWNCAST, UNCHECKED_SUPER_TO_ARCHETYPE, IS_SUBTYPE -> NodeLayout.of(2, 3, 0);
            case REBIND_THIS_IN_CONSTRUCTOR -> NodeLayout.of(2, 0, 0);
            case IF -> NodeLayout.of(3, 2, 0);
            case DEFAULT_VALUE -> NodeLayout.of(1, 0, 0);
        };
    }
}
