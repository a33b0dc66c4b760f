package com.exprtree.ast;

import java.util.List;

/**
 * {@code "a \(b) c"}: literal segments and interpolated expressions in order.
 * The range covers the literal token only.
 */
public record InterpolatedStringLiteralExpr(
    ExprHeader header,
    SourceLoc loc,
    List<Expr> segments
) implements LiteralExpr {

    public InterpolatedStringLiteralExpr {
        header.claim(ExprKind.INTERPOLATED_STRING_LITERAL);
    }

    public static InterpolatedStringLiteralExpr create(AstContext ctx, SourceLoc loc, List<Expr> segments) {
        return new InterpolatedStringLiteralExpr(
            ctx.allocate(ExprKind.INTERPOLATED_STRING_LITERAL), loc, ctx.allocateCopy(segments));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.INTERPOLATED_STRING_LITERAL;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitInterpolatedStringLiteralExpr(this);
    }
}
