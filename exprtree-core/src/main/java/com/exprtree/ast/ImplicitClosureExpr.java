package com.exprtree.ast;

import com.exprtree.types.Type;

import java.util.List;

/**
 * A closure the type checker wraps around an expression, e.g. for an
 * auto-closure parameter. Anchor falls back to the start of the range.
 */
public record ImplicitClosureExpr(
    ExprHeader header,
    Expr body,
    List<Pattern> params,
    List<DeclRef> captures
) implements ClosureExpr {

    public ImplicitClosureExpr {
        header.claim(ExprKind.IMPLICIT_CLOSURE);
    }

    public static ImplicitClosureExpr create(AstContext ctx, Expr body, List<Pattern> params,
                                             List<DeclRef> captures, Type type) {
        return new ImplicitClosureExpr(ctx.allocate(ExprKind.IMPLICIT_CLOSURE, type), body,
            ctx.allocateCopy(params), ctx.allocateCopy(captures));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.IMPLICIT_CLOSURE;
    }

    @Override
    public SourceRange sourceRange() {
        return body.sourceRange();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitImplicitClosureExpr(this);
    }
}
