package com.exprtree.ast;

import com.exprtree.arena.NodeLayout;
import com.exprtree.types.FunctionType;
import com.exprtree.types.TupleType;
import com.exprtree.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code func} expression or the body of a function declaration.
 *
 * <p>Parameter patterns come in pairs: for each curried level, the pattern
 * callers see and the pattern the body binds. Both halves are stored after
 * the node header, argument patterns first.</p>
 *
 * @param body the body, or null for a declaration without one
 */
public record FuncExpr(
    ExprHeader header,
    SourceLoc funcLoc,
    TrailingArray<Pattern> paramPatternPairs,
    TypeLoc returnTypeLoc,
    BraceStmt body,
    List<DeclRef> captures
) implements CapturingExpr {

    public FuncExpr {
        header.claim(ExprKind.FUNC);
    }

    /** Bytes per trailing element. */
    public static final long ELEMENT_SIZE = NodeLayout.REFERENCE_SIZE;

    public static FuncExpr create(AstContext ctx, SourceLoc funcLoc, List<Pattern> argParams,
                                  List<Pattern> bodyParams, TypeLoc returnTypeLoc, BraceStmt body,
                                  List<DeclRef> captures) {
        if (argParams.size() != bodyParams.size()) {
            throw new IllegalArgumentException("Argument and body parameter patterns must pair up: "
                + argParams.size() + " vs " + bodyParams.size());
        }
        int numParams = argParams.size();
        ExprHeader header = ctx.allocateTrailing(ExprKind.FUNC, 2 * numParams, ELEMENT_SIZE);
        List<Pattern> pairs = new ArrayList<>(2 * numParams);
        pairs.addAll(argParams);
        pairs.addAll(bodyParams);
        return new FuncExpr(header, funcLoc, TrailingArray.copyOf(pairs), returnTypeLoc, body,
            ctx.allocateCopy(captures));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.FUNC;
    }

    public int numParamPatterns() {
        return paramPatternPairs.size() / 2;
    }

    public TrailingArray<Pattern> argParamPatterns() {
        return paramPatternPairs.slice(0, numParamPatterns());
    }

    public TrailingArray<Pattern> bodyParamPatterns() {
        return paramPatternPairs.slice(numParamPatterns(), paramPatternPairs.size());
    }

    @Override
    public List<Pattern> paramPatterns() {
        return argParamPatterns();
    }

    @Override
    public SourceRange sourceRange() {
        if (body != null) {
            return new SourceRange(funcLoc, body.endLoc());
        }
        if (returnTypeLoc != null && returnTypeLoc.hasLocation()) {
            return new SourceRange(funcLoc, returnTypeLoc.range().end());
        }
        if (numParamPatterns() == 0) {
            return new SourceRange(funcLoc);
        }
        return new SourceRange(funcLoc, argParamPatterns().last().endLoc());
    }

    @Override
    public SourceLoc loc() {
        return funcLoc;
    }

    /**
     * The type produced by fully applying the function: one function level is
     * peeled per curried parameter pattern. Null before type checking.
     */
    public Type resultType() {
        Type resultType = getType();
        if (resultType == null || resultType.isError()) {
            return resultType;
        }
        for (int i = 0, e = numParamPatterns(); i != e; ++i) {
            if (!(resultType instanceof FunctionType function)) {
                throw new IllegalStateException("Expected a function type, found '" + resultType.getString() + "'");
            }
            resultType = function.result();
        }
        return resultType != null ? resultType : TupleType.empty();
    }

    /**
     * The implicit {@code this} parameter of a non-static method, bound by the
     * first argument pattern as {@code (this : T)} with no source location.
     * Null when there is none.
     */
    public DeclRef implicitThisDecl() {
        if (numParamPatterns() == 0) {
            return null;
        }
        if (!(argParamPatterns().get(0) instanceof TypedPattern typed)) {
            return null;
        }
        if (typed.subPattern() instanceof NamedPattern named
            && named.boundName().equals("this")
            && named.nameLoc().isInvalid()) {
            return named.decl();
        }
        return null;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFuncExpr(this);
    }
}
