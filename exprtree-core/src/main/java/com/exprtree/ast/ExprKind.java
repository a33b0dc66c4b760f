package com.exprtree.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The closed set of expression variants, each tagged with its group.
 *
 * <p>This is the single point of extension. Adding a constant breaks every
 * exhaustive {@code switch} over this type (see {@link NodeLayouts}) until
 * the new kind is handled, and the matching record must implement every
 * abstract {@link Expr} method.</p>
 */
public enum ExprKind {
    ERROR(ExprGroup.EXPR),
    INTEGER_LITERAL(ExprGroup.LITERAL),
    FLOAT_LITERAL(ExprGroup.LITERAL),
    CHARACTER_LITERAL(ExprGroup.LITERAL),
    STRING_LITERAL(ExprGroup.LITERAL),
    INTERPOLATED_STRING_LITERAL(ExprGroup.LITERAL),
    DECL_REF(ExprGroup.EXPR),
    SUPER_REF(ExprGroup.EXPR),
    OTHER_CONSTRUCTOR_DECL_REF(ExprGroup.EXPR),
    UNRESOLVED_CONSTRUCTOR(ExprGroup.EXPR),
    OVERLOADED_DECL_REF(ExprGroup.OVERLOAD_SET_REF),
    OVERLOADED_MEMBER_REF(ExprGroup.OVERLOAD_SET_REF),
    UNRESOLVED_DECL_REF(ExprGroup.EXPR),
    UNRESOLVED_IF(ExprGroup.EXPR),
    UNRESOLVED_ELSE(ExprGroup.EXPR),
    UNRESOLVED_SPECIALIZE(ExprGroup.EXPR),
    MEMBER_REF(ExprGroup.EXPR),
    EXISTENTIAL_MEMBER_REF(ExprGroup.EXPR),
    ARCHETYPE_MEMBER_REF(ExprGroup.EXPR),
    GENERIC_MEMBER_REF(ExprGroup.EXPR),
    UNRESOLVED_MEMBER(ExprGroup.EXPR),
    PAREN(ExprGroup.EXPR),
    TUPLE(ExprGroup.EXPR),
    ARRAY(ExprGroup.EXPR),
    DICTIONARY(ExprGroup.EXPR),
    SUBSCRIPT(ExprGroup.EXPR),
    EXISTENTIAL_SUBSCRIPT(ExprGroup.EXPR),
    ARCHETYPE_SUBSCRIPT(ExprGroup.EXPR),
    GENERIC_SUBSCRIPT(ExprGroup.EXPR),
    UNRESOLVED_DOT(ExprGroup.EXPR),
    MODULE(ExprGroup.EXPR),
    TUPLE_ELEMENT(ExprGroup.EXPR),
    TUPLE_SHUFFLE(ExprGroup.IMPLICIT_CONVERSION),
    FUNCTION_CONVERSION(ExprGroup.IMPLICIT_CONVERSION),
    ERASURE(ExprGroup.IMPLICIT_CONVERSION),
    SPECIALIZE(ExprGroup.IMPLICIT_CONVERSION),
    LOAD(ExprGroup.IMPLICIT_CONVERSION),
    MATERIALIZE(ExprGroup.IMPLICIT_CONVERSION),
    REQUALIFY(ExprGroup.IMPLICIT_CONVERSION),
    METATYPE_CONVERSION(ExprGroup.IMPLICIT_CONVERSION),
    DERIVED_TO_BASE(ExprGroup.IMPLICIT_CONVERSION),
    ARCHETYPE_TO_SUPER(ExprGroup.IMPLICIT_CONVERSION),
    SCALAR_TO_TUPLE(ExprGroup.IMPLICIT_CONVERSION),
    BRIDGE_TO_BLOCK(ExprGroup.IMPLICIT_CONVERSION),
    ADDRESS_OF(ExprGroup.EXPR),
    SEQUENCE(ExprGroup.EXPR),
    FUNC(ExprGroup.CAPTURING),
    PIPE_CLOSURE(ExprGroup.CLOSURE),
    IMPLICIT_CLOSURE(ExprGroup.CLOSURE),
    NEW_ARRAY(ExprGroup.EXPR),
    METATYPE(ExprGroup.EXPR),
    OPAQUE_VALUE(ExprGroup.EXPR),
    ZERO_VALUE(ExprGroup.EXPR),
    CALL(ExprGroup.APPLY),
    PREFIX_UNARY(ExprGroup.APPLY),
    POSTFIX_UNARY(ExprGroup.APPLY),
    BINARY(ExprGroup.APPLY),
    DOT_SYNTAX_CALL(ExprGroup.SELF_APPLY),
    CONSTRUCTOR_REF_CALL(ExprGroup.SELF_APPLY),
    DOT_SYNTAX_BASE_IGNORED(ExprGroup.EXPR),
    COERCE(ExprGroup.EXPLICIT_CAST),
    UNCHECKED_DOWNCAST(ExprGroup.EXPLICIT_CAST),
    UNCHECKED_SUPER_TO_ARCHETYPE(ExprGroup.EXPLICIT_CAST),
    IS_SUBTYPE(ExprGroup.EXPLICIT_CAST),
    REBIND_THIS_IN_CONSTRUCTOR(ExprGroup.EXPR),
    IF(ExprGroup.EXPR),
    DEFAULT_VALUE(ExprGroup.EXPR);

    private final ExprGroup group;
    private final String kindName;

    ExprKind(ExprGroup group) {
        this.group = group;
        this.kindName = camelCase(name());
    }

    /** The innermost group this kind is declared in. */
    public ExprGroup group() {
        return group;
    }

    public boolean isA(ExprGroup other) {
        return group.isWithin(other);
    }

    /**
     * The variant identifier, e.g. {@code "IntegerLiteral"} for {@link #INTEGER_LITERAL}.
     */
    public String getKindName() {
        return kindName;
    }

    /** All kinds whose group chain contains {@code group}, in declaration order. */
    public static List<ExprKind> inGroup(ExprGroup group) {
        List<ExprKind> kinds = new ArrayList<>();
        for (ExprKind kind : values()) {
            if (kind.isA(group)) {
                kinds.add(kind);
            }
        }
        return Collections.unmodifiableList(kinds);
    }

    private static String camelCase(String constant) {
        StringBuilder sb = new StringBuilder(constant.length());
        for (String word : constant.split("_")) {
            sb.append(word.charAt(0));
            sb.append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
