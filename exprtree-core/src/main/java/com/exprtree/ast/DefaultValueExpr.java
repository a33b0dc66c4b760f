package com.exprtree.ast;

/**
 * A default argument value substituted at a call site. It takes its range
 * from the default expression but is always considered implicit.
 */
public record DefaultValueExpr(
    ExprHeader header,
    Expr subExpr
) implements Expr {

    public DefaultValueExpr {
        header.claim(ExprKind.DEFAULT_VALUE);
    }

    public static DefaultValueExpr create(AstContext ctx, Expr subExpr) {
        return new DefaultValueExpr(ctx.allocate(ExprKind.DEFAULT_VALUE), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DEFAULT_VALUE;
    }

    @Override
    public SourceRange sourceRange() {
        return subExpr.sourceRange();
    }

    @Override
    public SourceLoc loc() {
        return subExpr.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDefaultValueExpr(this);
    }
}
