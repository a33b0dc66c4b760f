package com.exprtree.ast;

/**
 * Abstract groupings of expression kinds. Every kind belongs to exactly one
 * group; groups nest through {@link #parent()}.
 */
public enum ExprGroup {
    EXPR(null),
    LITERAL(EXPR),
    OVERLOAD_SET_REF(EXPR),
    IMPLICIT_CONVERSION(EXPR),
    CAPTURING(EXPR),
    CLOSURE(CAPTURING),
    APPLY(EXPR),
    SELF_APPLY(APPLY),
    EXPLICIT_CAST(EXPR);

    private final ExprGroup parent;

    ExprGroup(ExprGroup parent) {
        this.parent = parent;
    }

    /** The enclosing group, or null for {@link #EXPR}. */
    public ExprGroup parent() {
        return parent;
    }

    public boolean isWithin(ExprGroup other) {
        for (ExprGroup g = this; g != null; g = g.parent) {
            if (g == other) {
                return true;
            }
        }
        return false;
    }
}
