package com.exprtree.ast;

/**
 * {@code fn(arg)}. Anchor falls back to the start of the range.
 */
public record CallExpr(
    ExprHeader header,
    Expr fn,
    Expr arg,
    boolean isSuper
) implements ApplyExpr {

    public CallExpr {
        header.claim(ExprKind.CALL);
    }

    public static CallExpr create(AstContext ctx, Expr fn, Expr arg) {
        return create(ctx, fn, arg, false);
    }

    public static CallExpr create(AstContext ctx, Expr fn, Expr arg, boolean isSuper) {
        return new CallExpr(ctx.allocate(ExprKind.CALL), fn, arg, isSuper);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.CALL;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(fn.sourceRange(), arg.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCallExpr(this);
    }
}
