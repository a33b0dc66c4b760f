package com.exprtree.ast;

import java.util.List;

/**
 * {@code expr<T, U>} with the generic arguments not yet applied.
 */
public record UnresolvedSpecializeExpr(
    ExprHeader header,
    Expr subExpr,
    SourceLoc lAngleLoc,
    List<TypeLoc> unresolvedParams,
    SourceLoc rAngleLoc
) implements Expr {

    public UnresolvedSpecializeExpr {
        header.claim(ExprKind.UNRESOLVED_SPECIALIZE);
    }

    public static UnresolvedSpecializeExpr create(AstContext ctx, Expr subExpr, SourceLoc lAngleLoc,
                                                  List<TypeLoc> unresolvedParams, SourceLoc rAngleLoc) {
        return new UnresolvedSpecializeExpr(ctx.allocate(ExprKind.UNRESOLVED_SPECIALIZE),
            subExpr, lAngleLoc, ctx.allocateCopy(unresolvedParams), rAngleLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_SPECIALIZE;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(subExpr.sourceRange(), new SourceRange(rAngleLoc));
    }

    @Override
    public SourceLoc loc() {
        return subExpr.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedSpecializeExpr(this);
    }
}
