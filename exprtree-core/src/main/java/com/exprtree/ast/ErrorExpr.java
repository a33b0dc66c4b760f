package com.exprtree.ast;

/**
 * Stands in for an expression that failed to parse or type check.
 * Anchor falls back to the start of the range.
 */
public record ErrorExpr(
    ExprHeader header,
    SourceRange range
) implements Expr {

    public ErrorExpr {
        header.claim(ExprKind.ERROR);
    }

    public static ErrorExpr create(AstContext ctx, SourceRange range) {
        return new ErrorExpr(ctx.allocate(ExprKind.ERROR), range);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ERROR;
    }

    @Override
    public SourceRange sourceRange() {
        return range;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitErrorExpr(this);
    }
}
