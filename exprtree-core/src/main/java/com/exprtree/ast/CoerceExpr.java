package com.exprtree.ast;

/** {@code expr as T} where the conversion is statically known to succeed. */
public record CoerceExpr(
    ExprHeader header,
    Expr subExpr,
    SourceLoc asLoc,
    TypeLoc castTypeLoc
) implements ExplicitCastExpr {

    public CoerceExpr {
        header.claim(ExprKind.COERCE);
    }

    public static CoerceExpr create(AstContext ctx, Expr subExpr, SourceLoc asLoc, TypeLoc castTypeLoc) {
        return new CoerceExpr(ctx.allocate(ExprKind.COERCE), subExpr, asLoc, castTypeLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.COERCE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCoerceExpr(this);
    }
}
