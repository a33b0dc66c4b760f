package com.exprtree.ast;

/**
 * A resolved reference to a single declaration. An invalid location marks
 * a reference the compiler synthesized.
 */
public record DeclRefExpr(
    ExprHeader header,
    DeclRef decl,
    SourceLoc loc
) implements Expr {

    public DeclRefExpr {
        header.claim(ExprKind.DECL_REF);
    }

    public static DeclRefExpr create(AstContext ctx, DeclRef decl, SourceLoc loc) {
        return new DeclRefExpr(ctx.allocate(ExprKind.DECL_REF), decl, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DECL_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDeclRefExpr(this);
    }
}
