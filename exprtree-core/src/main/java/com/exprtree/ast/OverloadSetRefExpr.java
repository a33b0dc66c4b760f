package com.exprtree.ast;

import com.exprtree.types.MetatypeType;
import com.exprtree.types.Type;

import java.util.List;

/**
 * A reference to a set of overloaded declarations the type checker has not
 * yet narrowed down.
 */
public sealed interface OverloadSetRefExpr extends Expr permits OverloadedDeclRefExpr, OverloadedMemberRefExpr {

    List<DeclRef> decls();

    /**
     * Type of the object the overloads are looked up in, or null for an
     * unqualified reference.
     */
    default Type baseType() {
        if (this instanceof OverloadedMemberRefExpr member) {
            Type baseType = member.base().getType();
            return baseType == null ? null : baseType.getRValueType();
        }
        return null;
    }

    /**
     * Whether the reference is made through an object rather than a metatype.
     */
    default boolean hasBaseObject() {
        Type baseType = baseType();
        return baseType != null && !(baseType instanceof MetatypeType);
    }
}
