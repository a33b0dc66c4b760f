package com.exprtree.ast;

import com.exprtree.types.Type;

import java.util.List;

/**
 * Subscript on a bound generic type, with the substitutions that specialize it.
 */
public record GenericSubscriptExpr(
    ExprHeader header,
    Expr base,
    Expr index,
    DeclRef decl,
    List<Substitution> substitutions
) implements Expr {

    public GenericSubscriptExpr {
        header.claim(ExprKind.GENERIC_SUBSCRIPT);
    }

    public static GenericSubscriptExpr create(AstContext ctx, Expr base, Expr index, DeclRef decl,
                                              Type elementType, List<Substitution> substitutions) {
        return new GenericSubscriptExpr(ctx.allocate(ExprKind.GENERIC_SUBSCRIPT, elementType),
            base, index, decl, ctx.allocateCopy(substitutions));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.GENERIC_SUBSCRIPT;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), index.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitGenericSubscriptExpr(this);
    }
}
