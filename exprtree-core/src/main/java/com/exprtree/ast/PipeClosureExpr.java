package com.exprtree.ast;

import com.exprtree.types.FunctionType;
import com.exprtree.types.Type;

import java.util.List;

/**
 * A closure with an explicit parameter list, {@code { |x, y| ... }}.
 *
 * @param hasSingleExpressionBody whether the body is exactly one
 *     {@code return expr}, written as a bare expression in the source
 */
public record PipeClosureExpr(
    ExprHeader header,
    BraceStmt body,
    boolean hasSingleExpressionBody,
    List<Pattern> params,
    List<DeclRef> captures
) implements ClosureExpr {

    public PipeClosureExpr {
        header.claim(ExprKind.PIPE_CLOSURE);
    }

    public static PipeClosureExpr create(AstContext ctx, List<Pattern> params, BraceStmt body,
                                         boolean hasSingleExpressionBody, List<DeclRef> captures) {
        if (hasSingleExpressionBody
            && (body.elements().size() != 1 || !(body.elements().get(0) instanceof ReturnStmt))) {
            throw new IllegalArgumentException("Single-expression closure body must be one return statement");
        }
        return new PipeClosureExpr(ctx.allocate(ExprKind.PIPE_CLOSURE), body, hasSingleExpressionBody,
            ctx.allocateCopy(params), ctx.allocateCopy(captures));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.PIPE_CLOSURE;
    }

    @Override
    public SourceRange sourceRange() {
        return body.sourceRange();
    }

    @Override
    public SourceLoc loc() {
        return body.startLoc();
    }

    public Expr singleExpressionBody() {
        return singleReturn().getResult();
    }

    /**
     * Replaces the single expression, as the type checker does when it
     * rewrites the body.
     */
    public void setSingleExpressionBody(Expr newBody) {
        singleReturn().setResult(newBody);
    }

    private ReturnStmt singleReturn() {
        if (!hasSingleExpressionBody) {
            throw new IllegalStateException("Not a single-expression body");
        }
        return (ReturnStmt) body.elements().get(0);
    }

    /**
     * The type the closure returns, or the error type unchanged.
     */
    public Type resultType() {
        Type type = getType();
        if (type == null) {
            throw new IllegalStateException("Closure has not been type checked");
        }
        if (type.isError()) {
            return type;
        }
        if (!(type instanceof FunctionType function)) {
            throw new IllegalStateException("Closure has non-function type '" + type.getString() + "'");
        }
        return function.result();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPipeClosureExpr(this);
    }
}
