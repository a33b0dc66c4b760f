package com.exprtree.ast;

/**
 * The ternary {@code cond ? then : else}, anchored at the question mark.
 */
public record IfExpr(
    ExprHeader header,
    Expr condExpr,
    SourceLoc questionLoc,
    Expr thenExpr,
    SourceLoc colonLoc,
    Expr elseExpr
) implements Expr {

    public IfExpr {
        header.claim(ExprKind.IF);
    }

    public static IfExpr create(AstContext ctx, Expr condExpr, SourceLoc questionLoc, Expr thenExpr,
                                SourceLoc colonLoc, Expr elseExpr) {
        return new IfExpr(ctx.allocate(ExprKind.IF), condExpr, questionLoc, thenExpr, colonLoc, elseExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.IF;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(condExpr.sourceRange(), elseExpr.sourceRange());
    }

    @Override
    public SourceLoc loc() {
        return questionLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIfExpr(this);
    }
}
