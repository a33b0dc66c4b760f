package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * A value computed elsewhere and referenced here without re-evaluation.
 */
public record OpaqueValueExpr(
    ExprHeader header,
    SourceLoc loc
) implements Expr {

    public OpaqueValueExpr {
        header.claim(ExprKind.OPAQUE_VALUE);
    }

    public static OpaqueValueExpr create(AstContext ctx, SourceLoc loc, Type type) {
        return new OpaqueValueExpr(ctx.allocate(ExprKind.OPAQUE_VALUE, type), loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OPAQUE_VALUE;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOpaqueValueExpr(this);
    }
}
