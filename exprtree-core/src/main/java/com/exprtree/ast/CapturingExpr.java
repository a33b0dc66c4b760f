package com.exprtree.ast;

import java.util.List;

/**
 * Function-like expressions that capture declarations from their context.
 */
public sealed interface CapturingExpr extends Expr permits FuncExpr, ClosureExpr {

    List<DeclRef> captures();

    /**
     * The parameter patterns callers bind arguments to.
     */
    List<Pattern> paramPatterns();
}
