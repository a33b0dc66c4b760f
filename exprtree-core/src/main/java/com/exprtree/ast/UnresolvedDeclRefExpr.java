package com.exprtree.ast;

/**
 * A name the parser could not bind yet.
 */
public record UnresolvedDeclRefExpr(
    ExprHeader header,
    String name,
    SourceLoc loc
) implements Expr {

    public UnresolvedDeclRefExpr {
        header.claim(ExprKind.UNRESOLVED_DECL_REF);
    }

    public static UnresolvedDeclRefExpr create(AstContext ctx, String name, SourceLoc loc) {
        return new UnresolvedDeclRefExpr(ctx.allocate(ExprKind.UNRESOLVED_DECL_REF), name, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_DECL_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedDeclRefExpr(this);
    }
}
