package com.exprtree.ast;

/**
 * Conversions inserted by the type checker. They have no syntax of their own
 * and report the range and anchor of the converted expression.
 */
public sealed interface ImplicitConversionExpr extends Expr permits
    TupleShuffleExpr,
    FunctionConversionExpr,
    ErasureExpr,
    SpecializeExpr,
    LoadExpr,
    MaterializeExpr,
    RequalifyExpr,
    MetatypeConversionExpr,
    DerivedToBaseExpr,
    ArchetypeToSuperExpr,
    ScalarToTupleExpr,
    BridgeToBlockExpr {

    Expr subExpr();

    @Override
    default SourceRange sourceRange() {
        return subExpr().sourceRange();
    }

    @Override
    default SourceLoc loc() {
        return subExpr().loc();
    }
}
