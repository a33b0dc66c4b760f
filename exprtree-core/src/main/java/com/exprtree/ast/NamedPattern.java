package com.exprtree.ast;

public record NamedPattern(DeclRef decl, String boundName, SourceLoc nameLoc) implements Pattern {
    @Override
    public SourceRange sourceRange() {
        return new SourceRange(nameLoc);
    }
}
