package com.exprtree.ast;

import java.util.List;

/**
 * {@code (a, b: c, ...)}. Anchor falls back to the start of the range.
 *
 * <p>An element may be null where the type checker will fill in a default
 * argument. {@code elementNames} is null when no element is labeled;
 * otherwise it has one entry per element, null for unlabeled ones.</p>
 */
public record TupleExpr(
    ExprHeader header,
    SourceLoc lParenLoc,
    List<Expr> elements,
    List<String> elementNames,
    SourceLoc rParenLoc,
    boolean hasTrailingClosure
) implements Expr {

    public TupleExpr {
        header.claim(ExprKind.TUPLE);
    }

    public static TupleExpr create(AstContext ctx, SourceLoc lParenLoc, List<Expr> elements,
                                   List<String> elementNames, SourceLoc rParenLoc, boolean hasTrailingClosure) {
        if (elementNames != null && elementNames.size() != elements.size()) {
            throw new IllegalArgumentException(
                "Tuple has " + elements.size() + " elements but " + elementNames.size() + " names");
        }
        return new TupleExpr(ctx.allocate(ExprKind.TUPLE), lParenLoc, ctx.allocateCopy(elements),
            elementNames == null ? null : ctx.allocateCopy(elementNames), rParenLoc, hasTrailingClosure);
    }

    /** A synthesized tuple with no parentheses in the source. */
    public static TupleExpr createImplicit(AstContext ctx, List<Expr> elements) {
        return create(ctx, SourceLoc.INVALID, elements, null, SourceLoc.INVALID, false);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.TUPLE;
    }

    public int numElements() {
        return elements.size();
    }

    public Expr element(int index) {
        return elements.get(index);
    }

    /** The label of element {@code index}, or null. */
    public String elementName(int index) {
        return elementNames == null ? null : elementNames.get(index);
    }

    /**
     * The parentheses when written and not followed by a trailing closure,
     * else the span of the elements, else an invalid range.
     */
    @Override
    public SourceRange sourceRange() {
        if (lParenLoc.isValid() && !hasTrailingClosure) {
            if (rParenLoc.isInvalid()) {
                throw new IllegalStateException("Mismatched parentheses in tuple expression");
            }
            return new SourceRange(lParenLoc, rParenLoc);
        }
        Expr first = null;
        Expr last = null;
        for (Expr element : elements) {
            if (element != null) {
                if (first == null) {
                    first = element;
                }
                last = element;
            }
        }
        if (first == null) {
            return lParenLoc.isValid() ? new SourceRange(lParenLoc) : SourceRange.INVALID;
        }
        SourceLoc start = lParenLoc.isValid() ? lParenLoc : first.startLoc();
        return new SourceRange(start, last.endLoc());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitTupleExpr(this);
    }
}
