package com.exprtree.ast;

/**
 * A character literal holding one Unicode code point.
 */
public record CharacterLiteralExpr(
    ExprHeader header,
    int value,
    SourceLoc loc
) implements LiteralExpr {

    public CharacterLiteralExpr {
        header.claim(ExprKind.CHARACTER_LITERAL);
    }

    public static CharacterLiteralExpr create(AstContext ctx, int value, SourceLoc loc) {
        if (!Character.isValidCodePoint(value)) {
            throw new IllegalArgumentException("Not a code point: " + value);
        }
        return new CharacterLiteralExpr(ctx.allocate(ExprKind.CHARACTER_LITERAL), value, loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.CHARACTER_LITERAL;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCharacterLiteralExpr(this);
    }
}
