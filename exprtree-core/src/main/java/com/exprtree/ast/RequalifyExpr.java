package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Adjusts the qualifiers of an lvalue without changing its object type.
 */
public record RequalifyExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public RequalifyExpr {
        header.claim(ExprKind.REQUALIFY);
    }

    public static RequalifyExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new RequalifyExpr(ctx.allocate(ExprKind.REQUALIFY, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.REQUALIFY;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRequalifyExpr(this);
    }
}
