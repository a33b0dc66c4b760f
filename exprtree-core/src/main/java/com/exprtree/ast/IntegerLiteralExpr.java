package com.exprtree.ast;

import com.exprtree.literal.FixedWidthInteger;
import com.exprtree.literal.IntegerLiteralDecoder;
import com.exprtree.types.BuiltinIntegerType;
import com.exprtree.types.Type;

/**
 * An integer literal, kept as its token text until the type is known.
 */
public record IntegerLiteralExpr(
    ExprHeader header,
    String text,
    SourceLoc loc
) implements LiteralExpr {

    public IntegerLiteralExpr {
        header.claim(ExprKind.INTEGER_LITERAL);
    }

    public static IntegerLiteralExpr create(AstContext ctx, String text, SourceLoc loc) {
        return new IntegerLiteralExpr(ctx.allocate(ExprKind.INTEGER_LITERAL), text, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.INTEGER_LITERAL;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    /**
     * Decodes the literal at the width of its resolved builtin integer type.
     *
     * @throws AssertionError if type checking has not assigned a builtin integer type
     */
    public FixedWidthInteger value() {
        Type type = getType();
        if (type == null || type.isUnresolved()) {
            throw new AssertionError("Semantic analysis has not completed");
        }
        if (!(type instanceof BuiltinIntegerType integerType)) {
            throw new AssertionError("Integer literal has non-integer type '" + type.getString() + "'");
        }
        return IntegerLiteralDecoder.decode(text, integerType.bitWidth());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIntegerLiteralExpr(this);
    }
}
