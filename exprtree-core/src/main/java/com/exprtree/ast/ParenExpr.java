package com.exprtree.ast;

/**
 * {@code (expr)}. Transparent: it passes through the value of its operand.
 * Anchor falls back to the start of the range.
 *
 * @param hasTrailingClosure whether the operand is a closure written after
 *     the parentheses, in which case the range extends to the closure's end
 */
public record ParenExpr(
    ExprHeader header,
    SourceLoc lParenLoc,
    Expr subExpr,
    SourceLoc rParenLoc,
    boolean hasTrailingClosure
) implements Expr {

    public ParenExpr {
        header.claim(ExprKind.PAREN);
    }

    public static ParenExpr create(AstContext ctx, SourceLoc lParenLoc, Expr subExpr, SourceLoc rParenLoc,
                                   boolean hasTrailingClosure) {
        return new ParenExpr(ctx.allocate(ExprKind.PAREN), lParenLoc, subExpr, rParenLoc, hasTrailingClosure);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.PAREN;
    }

    @Override
    public SourceRange sourceRange() {
        if (lParenLoc.isValid() && !hasTrailingClosure) {
            return new SourceRange(lParenLoc, rParenLoc);
        }
        return SourceRange.merge(new SourceRange(lParenLoc), subExpr.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitParenExpr(this);
    }
}
