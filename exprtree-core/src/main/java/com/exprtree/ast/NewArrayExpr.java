package com.exprtree.ast;

import com.exprtree.arena.NodeLayout;

import java.util.List;

/**
 * {@code new T[n][m]}. One bound per dimension, stored after the node header.
 *
 * @param injectionFunction the function the type checker picked to build the
 *     array from raw storage, or null
 */
public record NewArrayExpr(
    ExprHeader header,
    SourceLoc newLoc,
    TypeLoc elementTypeLoc,
    TrailingArray<NewArrayExpr.Bound> bounds,
    Expr injectionFunction
) implements Expr {

    public NewArrayExpr {
        header.claim(ExprKind.NEW_ARRAY);
    }

    /**
     * One dimension; {@code value} is null for an empty bound, {@code []}.
     */
    public record Bound(Expr value, SourceRange brackets) {
    }

    /** Bytes per trailing element: a reference and the two bracket locations. */
    public static final long ELEMENT_SIZE = NodeLayout.REFERENCE_SIZE + 2L * NodeLayout.LOCATION_SIZE;

    public static NewArrayExpr create(AstContext ctx, SourceLoc newLoc, TypeLoc elementTypeLoc,
                                      List<Bound> bounds, Expr injectionFunction) {
        if (bounds.isEmpty()) {
            throw new IllegalArgumentException("New array expression needs at least one bound");
        }
        ExprHeader header = ctx.allocateTrailing(ExprKind.NEW_ARRAY, bounds.size(), ELEMENT_SIZE);
        return new NewArrayExpr(header, newLoc, elementTypeLoc, TrailingArray.copyOf(bounds), injectionFunction);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.NEW_ARRAY;
    }

    public boolean hasInjectionFunction() {
        return injectionFunction != null;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(new SourceRange(newLoc), bounds.last().brackets());
    }

    @Override
    public SourceLoc loc() {
        return newLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNewArrayExpr(this);
    }
}
