package com.exprtree.ast;

/**
 * {@code base.name} before name lookup. The base is null for a leading-dot
 * member reference.
 */
public record UnresolvedDotExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    String name,
    SourceLoc nameLoc
) implements Expr {

    public UnresolvedDotExpr {
        header.claim(ExprKind.UNRESOLVED_DOT);
    }

    public static UnresolvedDotExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, String name,
                                           SourceLoc nameLoc) {
        return new UnresolvedDotExpr(ctx.allocate(ExprKind.UNRESOLVED_DOT), base, dotLoc, name, nameLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_DOT;
    }

    @Override
    public SourceRange sourceRange() {
        SourceRange start = base != null ? base.sourceRange() : new SourceRange(dotLoc);
        return SourceRange.merge(start, new SourceRange(nameLoc));
    }

    @Override
    public SourceLoc loc() {
        return nameLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedDotExpr(this);
    }
}
