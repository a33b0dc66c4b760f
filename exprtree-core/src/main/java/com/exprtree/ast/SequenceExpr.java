package com.exprtree.ast;

import com.exprtree.arena.NodeLayout;

import java.util.List;

/**
 * A flat run of operands and operators ({@code a + b * c}) awaiting
 * precedence folding. The operands are stored after the node header.
 * Anchor falls back to the start of the range.
 */
public record SequenceExpr(
    ExprHeader header,
    TrailingArray<Expr> elements
) implements Expr {

    public SequenceExpr {
        header.claim(ExprKind.SEQUENCE);
    }

    /** Bytes per trailing element. */
    public static final long ELEMENT_SIZE = NodeLayout.REFERENCE_SIZE;

    public static SequenceExpr create(AstContext ctx, List<Expr> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Operator sequence must not be empty");
        }
        ExprHeader header = ctx.allocateTrailing(ExprKind.SEQUENCE, elements.size(), ELEMENT_SIZE);
        return new SequenceExpr(header, TrailingArray.copyOf(elements));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SEQUENCE;
    }

    public int numElements() {
        return elements.size();
    }

    public Expr element(int index) {
        return elements.get(index);
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(elements.get(0).sourceRange(), elements.last().sourceRange());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSequenceExpr(this);
    }
}
