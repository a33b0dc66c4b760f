package com.exprtree;

import com.exprtree.ast.ApplyExpr;
import com.exprtree.ast.ArchetypeMemberRefExpr;
import com.exprtree.ast.CapturingExpr;
import com.exprtree.ast.DeclRef;
import com.exprtree.ast.DeclRefExpr;
import com.exprtree.ast.DefaultValueExpr;
import com.exprtree.ast.Expr;
import com.exprtree.ast.GenericMemberRefExpr;
import com.exprtree.ast.ImplicitConversionExpr;
import com.exprtree.ast.MemberRefExpr;
import com.exprtree.ast.MetatypeExpr;
import com.exprtree.ast.ParenExpr;
import com.exprtree.ast.Pattern;
import com.exprtree.ast.TupleExpr;
import com.exprtree.ast.UncheckedDowncastExpr;
import com.exprtree.ast.ZeroValueExpr;

import java.util.List;

/**
 * Semantic queries over expression trees.
 */
public final class ExprTraversal {

    private ExprTraversal() {
    }

    /**
     * Strips wrappers that do not change meaning: parentheses and default
     * argument markers, however deeply nested.
     */
    public static Expr semanticsProvidingExpr(Expr expr) {
        Expr current = expr;
        while (true) {
            if (current instanceof ParenExpr paren) {
                current = paren.subExpr();
            } else if (current instanceof DefaultValueExpr defaultValue) {
                current = defaultValue.subExpr();
            } else {
                return current;
            }
        }
    }

    /**
     * The expression that actually computes the value. Same as
     * {@link #semanticsProvidingExpr(Expr)} until tuple projections are
     * looked through.
     */
    public static Expr valueProvidingExpr(Expr expr) {
        return semanticsProvidingExpr(expr);
    }

    /**
     * Whether the compiler synthesized the expression rather than parsing it.
     */
    public static boolean isImplicit(Expr expr) {
        if (expr instanceof DeclRefExpr declRef) {
            return declRef.loc().isInvalid();
        }
        if (expr instanceof ImplicitConversionExpr conversion) {
            return isImplicit(conversion.subExpr());
        }
        if (expr instanceof MemberRefExpr memberRef) {
            return memberRef.nameLoc().isInvalid();
        }
        if (expr instanceof GenericMemberRefExpr memberRef) {
            return memberRef.nameLoc().isInvalid();
        }
        if (expr instanceof ArchetypeMemberRefExpr memberRef) {
            return memberRef.nameLoc().isInvalid();
        }
        if (expr instanceof MetatypeExpr metatype) {
            return metatype.loc().isInvalid();
        }
        if (expr instanceof ApplyExpr apply) {
            return apply.arg() != null && isImplicit(apply.arg());
        }
        if (expr instanceof TupleExpr tuple) {
            if (tuple.sourceRange().isValid()) {
                return false;
            }
            for (Expr element : tuple.elements()) {
                if (element != null && !isImplicit(element)) {
                    return false;
                }
            }
            return true;
        }
        if (expr instanceof UncheckedDowncastExpr downcast) {
            return downcast.asLoc().isInvalid() && isImplicit(downcast.subExpr());
        }
        return expr instanceof ZeroValueExpr || expr instanceof DefaultValueExpr;
    }

    /**
     * The declaration an application calls when its callee is a direct
     * reference, possibly parenthesized. Null for anything else, including
     * references behind conversions or method self-application.
     */
    public static DeclRef calledValue(ApplyExpr apply) {
        Expr fn = valueProvidingExpr(apply.fn());
        if (fn instanceof DeclRefExpr declRef) {
            return declRef.decl();
        }
        return null;
    }

    /**
     * Patterns callers bind arguments to: a function's argument patterns, or
     * a closure's parameter list.
     */
    public static List<Pattern> paramPatterns(CapturingExpr expr) {
        return expr.paramPatterns();
    }
}
