package com.exprtree.ast;

/**
 * {@code lhs op rhs}, applied as {@code op((lhs, rhs))}. The argument tuple
 * spans both operands, so it supplies the range.
 */
public record BinaryExpr(
    ExprHeader header,
    Expr fn,
    Expr arg,
    boolean isSuper
) implements ApplyExpr {

    public BinaryExpr {
        header.claim(ExprKind.BINARY);
    }

    public static BinaryExpr create(AstContext ctx, Expr fn, Expr arg) {
        return new BinaryExpr(ctx.allocate(ExprKind.BINARY), fn, arg, false);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.BINARY;
    }

    @Override
    public SourceRange sourceRange() {
        return arg.sourceRange();
    }

    @Override
    public SourceLoc loc() {
        return fn.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryExpr(this);
    }
}
