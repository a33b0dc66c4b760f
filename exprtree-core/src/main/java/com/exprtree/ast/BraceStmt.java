package com.exprtree.ast;

import java.util.List;

public record BraceStmt(SourceLoc lBraceLoc, List<Stmt> elements, SourceLoc rBraceLoc) implements Stmt {
    public BraceStmt {
        elements = List.copyOf(elements);
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(lBraceLoc, rBraceLoc);
    }
}
