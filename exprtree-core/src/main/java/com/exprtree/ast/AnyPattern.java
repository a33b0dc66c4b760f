package com.exprtree.ast;

/**
 * The wildcard {@code _}.
 */
public record AnyPattern(SourceLoc loc) implements Pattern {
    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }
}
