package com.exprtree.ast;

/** Conversion from a superclass to an archetype bound by it. */
public record UncheckedSuperToArchetypeExpr(
    ExprHeader header,
    Expr subExpr,
    SourceLoc asLoc,
    TypeLoc castTypeLoc
) implements ExplicitCastExpr {

    public UncheckedSuperToArchetypeExpr {
        header.claim(ExprKind.UNCHECKED_SUPER_TO_ARCHETYPE);
    }

    public static UncheckedSuperToArchetypeExpr create(AstContext ctx, Expr subExpr, SourceLoc asLoc, TypeLoc castTypeLoc) {
        return new UncheckedSuperToArchetypeExpr(ctx.allocate(ExprKind.UNCHECKED_SUPER_TO_ARCHETYPE), subExpr, asLoc, castTypeLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNCHECKED_SUPER_TO_ARCHETYPE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUncheckedSuperToArchetypeExpr(this);
    }
}
