package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Subscript on a value of protocol type.
 */
public record ExistentialSubscriptExpr(
    ExprHeader header,
    Expr base,
    Expr index,
    DeclRef decl
) implements Expr {

    public ExistentialSubscriptExpr {
        header.claim(ExprKind.EXISTENTIAL_SUBSCRIPT);
    }

    public static ExistentialSubscriptExpr create(AstContext ctx, Expr base, Expr index, DeclRef decl,
                                                  Type elementType) {
        return new ExistentialSubscriptExpr(ctx.allocate(ExprKind.EXISTENTIAL_SUBSCRIPT, elementType),
            base, index, decl);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.EXISTENTIAL_SUBSCRIPT;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), index.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitExistentialSubscriptExpr(this);
    }
}
