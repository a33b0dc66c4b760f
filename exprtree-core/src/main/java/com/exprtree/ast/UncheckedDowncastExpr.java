package com.exprtree.ast;

/**
 * A downcast from a class to one of its subclasses that is not checked at
 * run time. Synthesized downcasts have no cast keyword.
 */
public record UncheckedDowncastExpr(
    ExprHeader header,
    Expr subExpr,
    SourceLoc asLoc,
    TypeLoc castTypeLoc
) implements ExplicitCastExpr {

    public UncheckedDowncastExpr {
        header.claim(ExprKind.UNCHECKED_DOWNCAST);
    }

    public static UncheckedDowncastExpr create(AstContext ctx, Expr subExpr, SourceLoc asLoc, TypeLoc castTypeLoc) {
        return new UncheckedDowncastExpr(ctx.allocate(ExprKind.UNCHECKED_DOWNCAST), subExpr, asLoc, castTypeLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNCHECKED_DOWNCAST;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUncheckedDowncastExpr(this);
    }
}
