package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * {@code base[index]} on a concrete type. Anchor falls back to the start of
 * the range. {@code decl} is null until the subscript is resolved.
 */
public record SubscriptExpr(
    ExprHeader header,
    Expr base,
    Expr index,
    DeclRef decl
) implements Expr {

    public SubscriptExpr {
        header.claim(ExprKind.SUBSCRIPT);
    }

    /**
     * @param elementType element type of the resolved subscript, or null
     */
    public static SubscriptExpr create(AstContext ctx, Expr base, Expr index, DeclRef decl, Type elementType) {
        return new SubscriptExpr(ctx.allocate(ExprKind.SUBSCRIPT, elementType), base, index, decl);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SUBSCRIPT;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), index.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSubscriptExpr(this);
    }
}
