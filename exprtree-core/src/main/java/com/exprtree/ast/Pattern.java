package com.exprtree.ast;

/**
 * Parameter patterns bound by function and closure expressions.
 * Only the shapes the expression layer inspects are modeled.
 */
public sealed interface Pattern permits NamedPattern, TypedPattern, TuplePattern, AnyPattern {

    SourceRange sourceRange();

    default SourceLoc loc() {
        return sourceRange().start();
    }

    default SourceLoc endLoc() {
        return sourceRange().end();
    }
}
