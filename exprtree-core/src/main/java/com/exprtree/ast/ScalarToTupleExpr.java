package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Wraps a scalar as field {@code scalarField} of a tuple whose other fields
 * all have defaults.
 */
public record ScalarToTupleExpr(
    ExprHeader header,
    Expr subExpr,
    int scalarField
) implements ImplicitConversionExpr {

    public ScalarToTupleExpr {
        header.claim(ExprKind.SCALAR_TO_TUPLE);
    }

    public static ScalarToTupleExpr create(AstContext ctx, Expr subExpr, int scalarField, Type type) {
        return new ScalarToTupleExpr(ctx.allocate(ExprKind.SCALAR_TO_TUPLE, type), subExpr, scalarField);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SCALAR_TO_TUPLE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitScalarToTupleExpr(this);
    }
}
