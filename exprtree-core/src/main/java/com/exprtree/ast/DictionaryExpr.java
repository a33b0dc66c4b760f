package com.exprtree.ast;

/**
 * {@code [k: v, ...]}; the key/value pairs are held by a tuple operand.
 */
public record DictionaryExpr(
    ExprHeader header,
    SourceLoc lBracketLoc,
    Expr subExpr,
    SourceLoc rBracketLoc
) implements Expr {

    public DictionaryExpr {
        header.claim(ExprKind.DICTIONARY);
    }

    public static DictionaryExpr create(AstContext ctx, SourceLoc lBracketLoc, Expr subExpr,
                                        SourceLoc rBracketLoc) {
        return new DictionaryExpr(ctx.allocate(ExprKind.DICTIONARY), lBracketLoc, subExpr, rBracketLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.DICTIONARY;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(lBracketLoc, rBracketLoc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDictionaryExpr(this);
    }
}
