package com.exprtree.ast;

import com.exprtree.types.Type;

import java.util.List;

/**
 * Reorders the elements of a tuple. Entry {@code i} of {@code elementMapping}
 * is the source element for result element {@code i}; a negative entry
 * means the result element takes its default value.
 */
public record TupleShuffleExpr(
    ExprHeader header,
    Expr subExpr,
    List<Integer> elementMapping
) implements ImplicitConversionExpr {

    public TupleShuffleExpr {
        header.claim(ExprKind.TUPLE_SHUFFLE);
    }

    public static TupleShuffleExpr create(AstContext ctx, Expr subExpr, List<Integer> elementMapping, Type type) {
        return new TupleShuffleExpr(ctx.allocate(ExprKind.TUPLE_SHUFFLE, type), subExpr,
            ctx.allocateCopy(elementMapping));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.TUPLE_SHUFFLE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitTupleShuffleExpr(this);
    }
}
