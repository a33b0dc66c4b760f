package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Converts a class instance to one of its superclasses.
 */
public record DerivedToBaseExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public DerivedToBaseExpr {
        header.claim(ExprKind.DERIVED_TO_BASE);
    }

    public static DerivedToBaseExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new DerivedToBaseExpr(ctx.allocate(ExprKind.DERIVED_TO_BASE, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DERIVED_TO_BASE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDerivedToBaseExpr(this);
    }
}
