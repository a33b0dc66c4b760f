package com.exprtree.ast;

/**
 * {@code base.0} or {@code base.label}, resolved to a field number.
 */
public record TupleElementExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    int fieldNumber,
    SourceLoc nameLoc
) implements Expr {

    public TupleElementExpr {
        header.claim(ExprKind.TUPLE_ELEMENT);
    }

    public static TupleElementExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, int fieldNumber,
                                          SourceLoc nameLoc) {
        if (fieldNumber < 0) {
            throw new IllegalArgumentException("Negative tuple field number: " + fieldNumber);
        }
        return new TupleElementExpr(ctx.allocate(ExprKind.TUPLE_ELEMENT), base, dotLoc, fieldNumber, nameLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.TUPLE_ELEMENT;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), new SourceRange(nameLoc));
    }

    @Override
    public SourceLoc loc() {
        return nameLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitTupleElementExpr(this);
    }
}
