package com.exprtree.ast;

/**
 * {@code return expr}. The result may be replaced after type checking
 * rewrites a single-expression closure body.
 */
public final class ReturnStmt implements Stmt {

    private final SourceLoc returnLoc;
    private Expr result;

    public ReturnStmt(SourceLoc returnLoc, Expr result) {
        this.returnLoc = returnLoc;
        this.result = result;
    }

    public SourceLoc getReturnLoc() {
        return returnLoc;
    }

    /** The returned expression, or null for a bare {@code return}. */
    public Expr getResult() {
        return result;
    }

    void setResult(Expr result) {
        this.result = result;
    }

    @Override
    public SourceRange sourceRange() {
        if (result == null) {
            return new SourceRange(returnLoc);
        }
        return SourceRange.merge(new SourceRange(returnLoc), result.sourceRange());
    }
}
