package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Bridges a native function value to a block.
 */
public record BridgeToBlockExpr(
    ExprHeader header,
    Expr subExpr
) implements ImplicitConversionExpr {

    public BridgeToBlockExpr {
        header.claim(ExprKind.BRIDGE_TO_BLOCK);
    }

    public static BridgeToBlockExpr create(AstContext ctx, Expr subExpr, Type type) {
        return new BridgeToBlockExpr(ctx.allocate(ExprKind.BRIDGE_TO_BLOCK, type), subExpr);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.BRIDGE_TO_BLOCK;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBridgeToBlockExpr(this);
    }
}
