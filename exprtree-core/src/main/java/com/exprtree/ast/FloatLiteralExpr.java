package com.exprtree.ast;

import com.exprtree.literal.FixedWidthFloat;
import com.exprtree.literal.FloatLiteralDecoder;
import com.exprtree.types.BuiltinFloatType;
import com.exprtree.types.Type;

public record FloatLiteralExpr(
    ExprHeader header,
    String text,
    SourceLoc loc
) implements LiteralExpr {

    public FloatLiteralExpr {
        header.claim(ExprKind.FLOAT_LITERAL);
    }

    public static FloatLiteralExpr create(AstContext ctx, String text, SourceLoc loc) {
        return new FloatLiteralExpr(ctx.allocate(ExprKind.FLOAT_LITERAL), text, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.FLOAT_LITERAL;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    /**
     * Decodes the literal in the format of its resolved builtin float type.
     *
     * @throws AssertionError if type checking has not assigned a builtin float type
     */
    public FixedWidthFloat value() {
        Type type = getType();
        if (type == null || type.isUnresolved()) {
            throw new AssertionError("Semantic analysis has not completed");
        }
        if (!(type instanceof BuiltinFloatType floatType)) {
            throw new AssertionError("Float literal has non-float type '" + type.getString() + "'");
        }
        return FloatLiteralDecoder.decode(text, floatType.format());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFloatLiteralExpr(this);
    }
}
