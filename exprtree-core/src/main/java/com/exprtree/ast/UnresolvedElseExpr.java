package com.exprtree.ast;

/**
 * The {@code :} of a ternary inside an operator sequence, before folding.
 */
public record UnresolvedElseExpr(
    ExprHeader header,
    SourceLoc colonLoc
) implements Expr {

    public UnresolvedElseExpr {
        header.claim(ExprKind.UNRESOLVED_ELSE);
    }

    public static UnresolvedElseExpr create(AstContext ctx, SourceLoc colonLoc) {
        return new UnresolvedElseExpr(ctx.allocate(ExprKind.UNRESOLVED_ELSE), colonLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_ELSE;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(colonLoc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedElseExpr(this);
    }
}
