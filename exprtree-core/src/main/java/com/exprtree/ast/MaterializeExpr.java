package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Places an rvalue in temporary storage so it can be used as an lvalue.
 */
public record MaterializeExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public MaterializeExpr {
        header.claim(ExprKind.MATERIALIZE);
    }

    public static MaterializeExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new MaterializeExpr(ctx.allocate(ExprKind.MATERIALIZE, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.MATERIALIZE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMaterializeExpr(this);
    }
}
