package com.exprtree.ast;

/**
 * {@code lhs.rhs} where {@code lhs} is evaluated only for its side effects,
 * e.g. a static member reached through an instance.
 */
public record DotSyntaxBaseIgnoredExpr(
    ExprHeader header,
    Expr lhs,
    SourceLoc dotLoc,
    Expr rhs
) implements Expr {

    public DotSyntaxBaseIgnoredExpr {
        header.claim(ExprKind.DOT_SYNTAX_BASE_IGNORED);
    }

    public static DotSyntaxBaseIgnoredExpr create(AstContext ctx, Expr lhs, SourceLoc dotLoc, Expr rhs) {
        return new DotSyntaxBaseIgnoredExpr(ctx.allocate(ExprKind.DOT_SYNTAX_BASE_IGNORED), lhs, dotLoc, rhs);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DOT_SYNTAX_BASE_IGNORED;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(lhs.sourceRange(), rhs.sourceRange());
    }

    @Override
    public SourceLoc loc() {
        return dotLoc.isValid() ? dotLoc : rhs.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDotSyntaxBaseIgnoredExpr(this);
    }
}
