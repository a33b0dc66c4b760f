package com.exprtree.ast;

/**
 * A constructor reference applied to the metatype it constructs. Only the
 * constructor reference appears in the source.
 */
public record ConstructorRefCallExpr(
    ExprHeader header,
    Expr fn,
    Expr arg,
    boolean isSuper
) implements SelfApplyExpr {

    public ConstructorRefCallExpr {
        header.claim(ExprKind.CONSTRUCTOR_REF_CALL);
    }

    public static ConstructorRefCallExpr create(AstContext ctx, Expr fn, Expr base) {
        return new ConstructorRefCallExpr(ctx.allocate(ExprKind.CONSTRUCTOR_REF_CALL), fn, base, false);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.CONSTRUCTOR_REF_CALL;
    }

    @Override
    public SourceRange sourceRange() {
        return fn.sourceRange();
    }

    @Override
    public SourceLoc loc() {
        return fn.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConstructorRefCallExpr(this);
    }
}
