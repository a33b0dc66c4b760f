package com.exprtree.ast;

/**
 * An expression evaluated for its side effects.
 */
public record ExprStmt(Expr expr) implements Stmt {
    @Override
    public SourceRange sourceRange() {
        return expr.sourceRange();
    }
}
