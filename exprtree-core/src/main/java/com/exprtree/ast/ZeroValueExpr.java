package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * The zero-initialized value of a type. Always compiler-synthesized; the
 * location is where the value is needed.
 */
public record ZeroValueExpr(
    ExprHeader header,
    SourceLoc loc
) implements Expr {

    public ZeroValueExpr {
        header.claim(ExprKind.ZERO_VALUE);
    }

    public static ZeroValueExpr create(AstContext ctx, SourceLoc loc, Type type) {
        return new ZeroValueExpr(ctx.allocate(ExprKind.ZERO_VALUE, type), loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ZERO_VALUE;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitZeroValueExpr(this);
    }
}
