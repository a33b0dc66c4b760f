package com.exprtree.ast;

/**
 * {@code expr.init} before the initializer has been looked up.
 */
public record UnresolvedConstructorExpr(
    ExprHeader header,
    Expr subExpr,
    SourceLoc dotLoc,
    SourceLoc constructorLoc
) implements Expr {

    public UnresolvedConstructorExpr {
        header.claim(ExprKind.UNRESOLVED_CONSTRUCTOR);
    }

    public static UnresolvedConstructorExpr create(AstContext ctx, Expr subExpr, SourceLoc dotLoc,
                                                   SourceLoc constructorLoc) {
        return new UnresolvedConstructorExpr(
            ctx.allocate(ExprKind.UNRESOLVED_CONSTRUCTOR), subExpr, dotLoc, constructorLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_CONSTRUCTOR;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(subExpr.sourceRange(), new SourceRange(constructorLoc));
    }

    @Override
    public SourceLoc loc() {
        return constructorLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedConstructorExpr(this);
    }
}
