package com.exprtree.ast;

import com.exprtree.types.TupleType;

/**
 * Rebinds {@code this} to the result of delegating to another constructor.
 * Produces no value, so it is typed as the empty tuple from the start.
 */
public record RebindThisInConstructorExpr(
    ExprHeader header,
    Expr subExpr,
    DeclRef thisDecl
) implements Expr {

    public RebindThisInConstructorExpr {
        header.claim(ExprKind.REBIND_THIS_IN_CONSTRUCTOR);
    }

    public static RebindThisInConstructorExpr create(AstContext ctx, Expr subExpr, DeclRef thisDecl) {
        return new RebindThisInConstructorExpr(
            ctx.allocate(ExprKind.REBIND_THIS_IN_CONSTRUCTOR, TupleType.empty()), subExpr, thisDecl);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.REBIND_THIS_IN_CONSTRUCTOR;
    }

    @Override
    public SourceRange sourceRange() {
        return subExpr.sourceRange();
    }

    @Override
    public SourceLoc loc() {
        return subExpr.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRebindThisInConstructorExpr(this);
    }
}
