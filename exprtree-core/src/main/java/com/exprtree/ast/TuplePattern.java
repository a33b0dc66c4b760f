package com.exprtree.ast;

import java.util.List;

public record TuplePattern(SourceLoc lParenLoc, List<Pattern> fields, SourceLoc rParenLoc) implements Pattern {
    public TuplePattern {
        fields = List.copyOf(fields);
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(lParenLoc, rParenLoc);
    }
}
