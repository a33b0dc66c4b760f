package com.exprtree.ast;

import java.util.List;

public sealed interface ClosureExpr extends CapturingExpr permits PipeClosureExpr, ImplicitClosureExpr {

    List<Pattern> params();

    @Override
    default List<Pattern> paramPatterns() {
        return params();
    }
}
