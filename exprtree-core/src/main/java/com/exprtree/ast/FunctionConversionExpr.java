package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Converts a function value to a compatible function type.
 */
public record FunctionConversionExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public FunctionConversionExpr {
        header.claim(ExprKind.FUNCTION_CONVERSION);
    }

    public static FunctionConversionExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new FunctionConversionExpr(ctx.allocate(ExprKind.FUNCTION_CONVERSION, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.FUNCTION_CONVERSION;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionConversionExpr(this);
    }
}
