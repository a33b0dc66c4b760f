package com.exprtree.ast;

/**
 * A string literal; {@code value} has escapes already processed.
 */
public record StringLiteralExpr(
    ExprHeader header,
    String value,
    SourceLoc loc
) implements LiteralExpr {

    public StringLiteralExpr {
        header.claim(ExprKind.STRING_LITERAL);
    }

    public static StringLiteralExpr create(AstContext ctx, String value, SourceLoc loc) {
        return new StringLiteralExpr(ctx.allocate(ExprKind.STRING_LITERAL), value, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.STRING_LITERAL;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitStringLiteralExpr(this);
    }
}
