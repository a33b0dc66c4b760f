package com.exprtree.ast;

/**
 * Reference to another initializer of the same type, as in a delegating
 * {@code this.init(...)} call.
 */
public record OtherConstructorDeclRefExpr(
    ExprHeader header,
    DeclRef constructor,
    SourceLoc loc
) implements Expr {

    public OtherConstructorDeclRefExpr {
        header.claim(ExprKind.OTHER_CONSTRUCTOR_DECL_REF);
    }

    public static OtherConstructorDeclRefExpr create(AstContext ctx, DeclRef constructor, SourceLoc loc) {
        return new OtherConstructorDeclRefExpr(ctx.allocate(ExprKind.OTHER_CONSTRUCTOR_DECL_REF), constructor, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OTHER_CONSTRUCTOR_DECL_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOtherConstructorDeclRefExpr(this);
    }
}
