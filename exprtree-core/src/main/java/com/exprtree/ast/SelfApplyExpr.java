package com.exprtree.ast;

/**
 * Application of a method to the object it is looked up on, {@code x.method}.
 */
public sealed interface SelfApplyExpr extends ApplyExpr permits DotSyntaxCallExpr, ConstructorRefCallExpr {

    /** The object, which is the argument of the self application. */
    default Expr base() {
        return arg();
    }
}
