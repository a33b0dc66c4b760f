package com.exprtree.ast;

/**
 * The {@code super} keyword; {@code thisDecl} is the implicit self parameter
 * it reads.
 */
public record SuperRefExpr(
    ExprHeader header,
    DeclRef thisDecl,
    SourceLoc superLoc
) implements Expr {

    public SuperRefExpr {
        header.claim(ExprKind.SUPER_REF);
    }

    public static SuperRefExpr create(AstContext ctx, DeclRef thisDecl, SourceLoc superLoc) {
        return new SuperRefExpr(ctx.allocate(ExprKind.SUPER_REF), thisDecl, superLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SUPER_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(superLoc);
    }

    @Override
    public SourceLoc loc() {
        return superLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSuperRefExpr(this);
    }
}
