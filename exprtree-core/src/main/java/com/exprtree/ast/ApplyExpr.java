package com.exprtree.ast;

/**
 * Application of a function to an argument.
 */
public sealed interface ApplyExpr extends Expr permits
    CallExpr,
    PrefixUnaryExpr,
    PostfixUnaryExpr,
    BinaryExpr,
    SelfApplyExpr {

    Expr fn();

    /** The argument, usually a paren or tuple expression. */
    Expr arg();

    /** Whether this is a call through {@code super}. */
    boolean isSuper();
}
