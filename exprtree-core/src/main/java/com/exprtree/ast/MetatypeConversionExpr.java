package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Converts a derived-class metatype to a base-class metatype.
 */
public record MetatypeConversionExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public MetatypeConversionExpr {
        header.claim(ExprKind.METATYPE_CONVERSION);
    }

    public static MetatypeConversionExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new MetatypeConversionExpr(ctx.allocate(ExprKind.METATYPE_CONVERSION, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.METATYPE_CONVERSION;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMetatypeConversionExpr(this);
    }
}
