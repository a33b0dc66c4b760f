package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Wraps a concrete value in an existential of a protocol it conforms to.
 */
public record ErasureExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public ErasureExpr {
        header.claim(ExprKind.ERASURE);
    }

    public static ErasureExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new ErasureExpr(ctx.allocate(ExprKind.ERASURE, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ERASURE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitErasureExpr(this);
    }
}
