package com.exprtree.ast;

import com.exprtree.types.Type;

import java.util.List;

/**
 * Specializes a polymorphic function value with concrete substitutions.
 */
public record SpecializeExpr(
    ExprHeader header,
    Expr subExpr,
    List<Substitution> substitutions
) implements ImplicitConversionExpr {

    public SpecializeExpr {
        header.claim(ExprKind.SPECIALIZE);
    }

    public static SpecializeExpr create(AstContext ctx, Expr subExpr, List<Substitution> substitutions, Type type) {
        return new SpecializeExpr(ctx.allocate(ExprKind.SPECIALIZE, type), subExpr,
            ctx.allocateCopy(substitutions));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SPECIALIZE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSpecializeExpr(this);
    }
}
