package com.exprtree.ast;

/**
 * {@code base.method}: the method reference applied to its object. The base
 * is written first, so the range runs from the base to the method name.
 */
public record DotSyntaxCallExpr(
    ExprHeader header,
    Expr fn,
    SourceLoc dotLoc,
    Expr arg,
    boolean isSuper
) implements SelfApplyExpr {

    public DotSyntaxCallExpr {
        header.claim(ExprKind.DOT_SYNTAX_CALL);
    }

    public static DotSyntaxCallExpr create(AstContext ctx, Expr fn, SourceLoc dotLoc, Expr base) {
        return create(ctx, fn, dotLoc, base, false);
    }

    public static DotSyntaxCallExpr create(AstContext ctx, Expr fn, SourceLoc dotLoc, Expr base,
                                           boolean isSuper) {
        return new DotSyntaxCallExpr(ctx.allocate(ExprKind.DOT_SYNTAX_CALL), fn, dotLoc, base, isSuper);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DOT_SYNTAX_CALL;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(arg.sourceRange(), fn.sourceRange());
    }

    @Override
    public SourceLoc loc() {
        return dotLoc.isValid() ? dotLoc : fn.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDotSyntaxCallExpr(this);
    }
}
