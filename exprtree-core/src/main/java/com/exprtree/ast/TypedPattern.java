package com.exprtree.ast;

/**
 * {@code pattern : Type}
 */
public record TypedPattern(Pattern subPattern, TypeLoc typeLoc) implements Pattern {
    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(subPattern.sourceRange(), typeLoc.range());
    }
}
