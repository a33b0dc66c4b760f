package com.exprtree.ast;

/**
 * {@code &lvalue}. Anchor falls back to the start of the range, which is the
 * operator.
 */
public record AddressOfExpr(
    ExprHeader header,
    SourceLoc operatorLoc,
    Expr subExpr
) implements Expr {

    public AddressOfExpr {
        header.claim(ExprKind.ADDRESS_OF);
    }

    public static AddressOfExpr create(AstContext ctx, SourceLoc operatorLoc, Expr subExpr) {
        return new AddressOfExpr(ctx.allocate(ExprKind.ADDRESS_OF), operatorLoc, subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ADDRESS_OF;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(new SourceRange(operatorLoc), subExpr.sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAddressOfExpr(this);
    }
}
