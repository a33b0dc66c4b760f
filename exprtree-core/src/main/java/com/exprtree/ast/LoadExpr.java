package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Reads the value out of an lvalue.
 */
public record LoadExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public LoadExpr {
        header.claim(ExprKind.LOAD);
    }

    public static LoadExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new LoadExpr(ctx.allocate(ExprKind.LOAD, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.LOAD;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLoadExpr(this);
    }
}
