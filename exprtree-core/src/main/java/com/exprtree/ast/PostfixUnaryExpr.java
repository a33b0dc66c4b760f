package com.exprtree.ast;

/**
 * {@code arg op}. The operand precedes the operator in the source.
 */
public record PostfixUnaryExpr(
    ExprHeader header,
    Expr fn,
    Expr arg,
    boolean isSuper
) implements ApplyExpr {

    public PostfixUnaryExpr {
        header.claim(ExprKind.POSTFIX_UNARY);
    }

    public static PostfixUnaryExpr create(AstContext ctx, Expr fn, Expr arg) {
        return new PostfixUnaryExpr(ctx.allocate(ExprKind.POSTFIX_UNARY), fn, arg, false);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.POSTFIX_UNARY;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(arg.sourceRange(), fn.sourceRange());
    }

    @Override
    public SourceLoc loc() {
        return fn.loc();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPostfixUnaryExpr(this);
    }
}
