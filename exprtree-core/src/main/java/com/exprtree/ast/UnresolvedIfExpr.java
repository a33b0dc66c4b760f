package com.exprtree.ast;

/**
 * The {@code ?} of a ternary inside an operator sequence, before folding.
 */
public record UnresolvedIfExpr(
    ExprHeader header,
    SourceLoc questionLoc
) implements Expr {

    public UnresolvedIfExpr {
        header.claim(ExprKind.UNRESOLVED_IF);
    }

    public static UnresolvedIfExpr create(AstContext ctx, SourceLoc questionLoc) {
        return new UnresolvedIfExpr(ctx.allocate(ExprKind.UNRESOLVED_IF), questionLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_IF;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(questionLoc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedIfExpr(this);
    }
}
