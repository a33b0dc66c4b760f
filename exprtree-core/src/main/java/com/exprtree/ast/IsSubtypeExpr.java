package com.exprtree.ast;

/** {@code expr is T}. */
public record IsSubtypeExpr(
    ExprHeader header,
    Expr subExpr,
    SourceLoc asLoc,
    TypeLoc castTypeLoc
) implements ExplicitCastExpr {

    public IsSubtypeExpr {
        header.claim(ExprKind.IS_SUBTYPE);
    }

    public static IsSubtypeExpr create(AstContext ctx, Expr subExpr, SourceLoc asLoc, TypeLoc castTypeLoc) {
        return new IsSubtypeExpr(ctx.allocate(ExprKind.IS_SUBTYPE), subExpr, asLoc, castTypeLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.IS_SUBTYPE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIsSubtypeExpr(this);
    }
}
