package com.exprtree.ast;

import com.exprtree.types.ArchetypeType;
import com.exprtree.types.Type;

/**
 * Subscript on a value of archetype type.
 */
public record ArchetypeSubscriptExpr(
    ExprHeader header,
    Expr base,
    Expr index,
    DeclRef decl
) implements Expr {

    public ArchetypeSubscriptExpr {
        header.claim(ExprKind.ARCHETYPE_SUBSCRIPT);
    }

    public static ArchetypeSubscriptExpr create(AstContext ctx, Expr base, Expr index, DeclRef decl,
                                                Type elementType) {
        Type baseType = base.getType();
        if (baseType != null && !(baseType.getRValueType() instanceof ArchetypeType)) {
            throw new IllegalArgumentException(
                "Use SubscriptExpr for non-archetype base type '" + baseType.getString() + "'");
        }
        return new ArchetypeSubscriptExpr(ctx.allocate(ExprKind.ARCHETYPE_SUBSCRIPT, elementType),
            base, index, decl);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARCHETYPE_SUBSCRIPT;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), index.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArchetypeSubscriptExpr(this);
    }
}
