package com.exprtree.ast;

/**
 * Statements that appear inside closure bodies. The statement family proper
 * lives elsewhere; these are the shapes expression nodes need to reach into.
 */
public sealed interface Stmt permits BraceStmt, ReturnStmt, ExprStmt {

    SourceRange sourceRange();

    default SourceLoc startLoc() {
        return sourceRange().start();
    }

    default SourceLoc endLoc() {
        return sourceRange().end();
    }
}
