package com.exprtree.ast;

/**
 * {@code expr.metatype}, or a bare type used as a value when {@code base} is null.
 */
public record MetatypeExpr(
    ExprHeader header,
    Expr base,
    SourceLoc metatypeLoc
) implements Expr {

    public MetatypeExpr {
        header.claim(ExprKind.METATYPE);
    }

    public static MetatypeExpr create(AstContext ctx, Expr base, SourceLoc metatypeLoc) {
        return new MetatypeExpr(ctx.allocate(ExprKind.METATYPE), base, metatypeLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.METATYPE;
    }

    @Override
    public SourceRange sourceRange() {
        if (base == null) {
            return new SourceRange(metatypeLoc);
        }
        return SourceRange.merge(base.sourceRange(), new SourceRange(metatypeLoc));
    }

    @Override
    public SourceLoc loc() {
        return metatypeLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMetatypeExpr(this);
    }
}
