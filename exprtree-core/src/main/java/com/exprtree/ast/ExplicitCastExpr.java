package com.exprtree.ast;

/**
 * {@code expr as Type} and its checked and unchecked relatives.
 */
public sealed interface ExplicitCastExpr extends Expr permits
    CoerceExpr,
    UncheckedDowncastExpr,
    UncheckedSuperToArchetypeExpr,
    IsSubtypeExpr {

    Expr subExpr();

    /** Location of the cast keyword; invalid when the cast was synthesized. */
    SourceLoc asLoc();

    TypeLoc castTypeLoc();

    @Override
    default SourceRange sourceRange() {
        SourceRange keyword = new SourceRange(asLoc());
        SourceRange castType = castTypeLoc().hasLocation() ? castTypeLoc().range() : keyword;
        return SourceRange.merge(SourceRange.merge(subExpr().sourceRange(), keyword), castType);
    }

    @Override
    default SourceLoc loc() {
        return asLoc().isValid() ? asLoc() : subExpr().loc();
    }
}
