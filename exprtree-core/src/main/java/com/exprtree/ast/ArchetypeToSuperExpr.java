package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Converts a value of archetype type to its superclass bound.
 */
public record ArchetypeToSuperExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public ArchetypeToSuperExpr {
        header.claim(ExprKind.ARCHETYPE_TO_SUPER);
    }

    public static ArchetypeToSuperExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new ArchetypeToSuperExpr(ctx.allocate(ExprKind.ARCHETYPE_TO_SUPER, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARCHETYPE_TO_SUPER;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArchetypeToSuperExpr(this);
    }
}
