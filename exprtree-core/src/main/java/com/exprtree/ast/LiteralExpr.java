package com.exprtree.ast;

/**
 * Literal values written directly in the source.
 */
public sealed interface LiteralExpr extends Expr permits
    IntegerLiteralExpr,
    FloatLiteralExpr,
    CharacterLiteralExpr,
    StringLiteralExpr,
    InterpolatedStringLiteralExpr {
}
