package com.exprtree.ast;

/**
 * {@code [a, b, c]}; the elements are held by a tuple or paren operand.
 */
public record ArrayExpr(
    ExprHeader header,
    SourceLoc lBracketLoc,
    Expr subExpr,
    SourceLoc rBracketLoc
) implements Expr {

    public ArrayExpr {
        header.claim(ExprKind.ARRAY);
    }

    public static ArrayExpr create(AstContext ctx, SourceLoc lBracketLoc, Expr subExpr, SourceLoc rBracketLoc) {
        return new ArrayExpr(ctx.allocate(ExprKind.ARRAY), lBracketLoc, subExpr, rBracketLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARRAY;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(lBracketLoc, rBracketLoc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArrayExpr(this);
    }
}
