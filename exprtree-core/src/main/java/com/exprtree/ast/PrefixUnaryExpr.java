package com.exprtree.ast;

public record PrefixUnaryExpr(
    ExprHeader header,
    Expr fn,
    Expr arg,
    boolean isSuper
) implements ApplyExpr {

    public PrefixUnaryExpr {
        header.claim(ExprKind.PREFIX_UNARY);
    }

    public static PrefixUnaryExpr create(AstContext ctx, Expr fn, Expr arg) {
        return new PrefixUnaryExpr(ctx.allocate(ExprKind.PREFIX_UNARY), fn, arg, false);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.PREFIX_UNARY;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(fn.sourceRange(), arg.sourceRange());
    }

    @Override
    public SourceLoc loc() {
        return fn.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPrefixUnaryExpr(this);
    }
}
